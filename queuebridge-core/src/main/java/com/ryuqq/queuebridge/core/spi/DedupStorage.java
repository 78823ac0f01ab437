package com.ryuqq.queuebridge.core.spi;

/**
 * 중복 제거 저장소 SPI.
 *
 * <p>메시지 이름으로부터 만든 전체 키의 존재 여부를 조회합니다.
 * 원본 저장소 계약과 같이, 처음 본 키는 기록하고 {@code false}를 반환하며
 * 이후 같은 키에 대해서는 {@code true}를 반환합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>키 기록과 조회의 원자성 (동일 키 동시 요청 시 하나만 false)</li>
 *   <li>키 만료 정책 (TTL)</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 권고적(advisory) 중복 제거입니다.
 * 존재 확인과 다른 producer의 push 사이의 경쟁은 허용됩니다.</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public interface DedupStorage {

    /**
     * 키 존재 여부 확인 (없으면 기록).
     *
     * @param key 전체 키
     * @return 이미 존재했으면 true
     * @throws IllegalArgumentException key가 null이거나 빈 문자열인 경우
     */
    boolean exists(String key);
}
