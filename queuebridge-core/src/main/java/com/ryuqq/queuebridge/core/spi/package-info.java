/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators the adapter talks to but does not implement itself.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.queuebridge.core.spi.RemoteQueue} - HTTP-polled remote queue primitives</li>
 *   <li>{@link com.ryuqq.queuebridge.core.spi.DedupStorage} - Existence store for duplicate suppression</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., queuebridge-adapter-inmemory, or an HTTP client module)
 * provide concrete implementations of these SPIs.</p>
 *
 * @since 1.0.0
 * @author QueueBridge Team
 */
package com.ryuqq.queuebridge.core.spi;
