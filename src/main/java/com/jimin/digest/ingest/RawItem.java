package com.jimin.digest.ingest;

/**
 * 외부 수집 어댑터가 넘겨주는 원본 아이템 (출처별 타입)
 *
 * 코어 로직은 RawItem을 직접 다루지 않는다.
 * ItemNormalizer가 NormalizedItem으로 바꾼 뒤에만 검증/분류/점수 계산을 한다.
 */
public interface RawItem {

    String title();

    String url();
}
