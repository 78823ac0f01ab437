/**
 * 프로세스 내부 버퍼 작업 큐와 백오프 계산.
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
package com.ryuqq.queuebridge.adapter.runner.workqueue;
