/**
 * Entity 메타데이터와 unit.
 *
 * <p>entity type은 {@link com.ryuqq.mnemo.core.model.EntityType#builder(String)}로 런타임에 선언합니다.
 * unit은 값을 property 묶음에 담으며 reflection이나 생성 코드를 쓰지 않습니다.</p>
 *
 * @since 1.0.0
 * @author Mnemo Team
 */
package com.ryuqq.mnemo.core.model;
