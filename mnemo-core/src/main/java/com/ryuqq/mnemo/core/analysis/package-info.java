/**
 * Unit 분석 도구.
 *
 * <p>{@link com.ryuqq.mnemo.core.analysis.CrossTab}은 recall한 unit으로 교차표를 만들고,
 * 셀 집계는 {@link com.ryuqq.mnemo.core.analysis.Aggregate}로 지정합니다.
 * unit 정렬은 {@link com.ryuqq.mnemo.core.query.Order#unitComparator()}를 사용합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
package com.ryuqq.mnemo.core.analysis;
