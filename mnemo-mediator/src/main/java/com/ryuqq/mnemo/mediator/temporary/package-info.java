/**
 * 임시 unit (만료 시각을 가진 unit) 지원.
 *
 * <ul>
 *   <li>{@link com.ryuqq.mnemo.mediator.temporary.TemporaryHooks}: recall 시 만료 확인, decay</li>
 *   <li>{@link com.ryuqq.mnemo.mediator.temporary.TemporarySweeper}: 만료 unit 주기적 제거</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
package com.ryuqq.mnemo.mediator.temporary;
