package com.ryuqq.reskit.core.model;

import java.util.Objects;

/**
 * 백엔드가 로드한 불투명(opaque) 리소스.
 *
 * <p>Asset은 실제 콘텐츠 객체와 선택적인 백엔드 메타데이터를 담습니다.
 * 엔진은 콘텐츠의 형식을 해석하지 않으며, 메타데이터는 해당 리소스를 만든
 * 백엔드만 의미를 압니다 (예: 아카이브 백엔드는 소속 번들 이름을 기록).</p>
 *
 * <p>동등성은 콘텐츠 객체의 동일성(identity)으로 판단합니다. 같은 값을 가진
 * 두 번의 로드 결과는 서로 다른 Asset입니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public final class Asset {

    private final Object content;
    private final String metadata;

    private Asset(Object content, String metadata) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        this.content = content;
        this.metadata = metadata;
    }

    /**
     * 메타데이터 없이 Asset 생성.
     *
     * @param content 콘텐츠 객체
     * @return Asset 인스턴스
     * @throws IllegalArgumentException content가 null인 경우
     */
    public static Asset of(Object content) {
        return new Asset(content, null);
    }

    /**
     * 메타데이터를 포함한 Asset 생성.
     *
     * @param content 콘텐츠 객체
     * @param metadata 백엔드 메타데이터 (null 가능)
     * @return Asset 인스턴스
     * @throws IllegalArgumentException content가 null인 경우
     */
    public static Asset of(Object content, String metadata) {
        return new Asset(content, metadata);
    }

    /**
     * 콘텐츠 조회.
     *
     * @return 콘텐츠 객체
     */
    public Object getContent() {
        return content;
    }

    /**
     * 지정한 타입으로 콘텐츠 조회.
     *
     * @param type 기대 타입
     * @param <T> 콘텐츠 타입
     * @return 캐스팅된 콘텐츠
     * @throws IllegalArgumentException type이 null이거나 콘텐츠가 해당 타입이 아닌 경우
     */
    public <T> T getContent(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (!type.isInstance(content)) {
            throw new IllegalArgumentException(
                "content is not a " + type.getName() + " (actual: " + content.getClass().getName() + ")"
            );
        }
        return type.cast(content);
    }

    /**
     * 메타데이터 조회.
     *
     * @return 메타데이터 (없으면 null)
     */
    public String getMetadata() {
        return metadata;
    }

    /**
     * 메타데이터 존재 여부.
     *
     * @return 메타데이터가 있으면 true
     */
    public boolean hasMetadata() {
        return metadata != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Asset asset = (Asset) o;
        return content == asset.content && Objects.equals(metadata, asset.metadata);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(content) + Objects.hashCode(metadata);
    }

    @Override
    public String toString() {
        return "Asset{" + content.getClass().getSimpleName()
            + (metadata != null ? ", metadata=" + metadata : "") + '}';
    }
}
