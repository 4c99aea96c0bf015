/**
 * Sandbox: 저장소 위의 스레드별 identity map.
 *
 * <p>{@link com.ryuqq.mnemo.core.spi.StorageManager#newSandbox()}로 얻고, 범위가 정해진 작업에는
 * {@link com.ryuqq.mnemo.core.sandbox.Sandbox#execute(com.ryuqq.mnemo.core.sandbox.SandboxWork)}를 권장합니다:</p>
 *
 * <pre>{@code
 * long adults = store.newSandbox().execute(box -> {
 *     Unit slug = animal.newUnit(Map.of("Species", "Slug", "Legs", 1));
 *     box.memorize(slug);
 *     return box.count(animal, Exprs.attr("Legs").ge(2));
 * });
 * }</pre>
 *
 * @since 1.0.0
 * @author Mnemo Team
 */
package com.ryuqq.mnemo.core.sandbox;
