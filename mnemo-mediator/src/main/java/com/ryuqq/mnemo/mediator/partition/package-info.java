/**
 * 이름 있는 저장소들에 entity type을 수직 분할.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
package com.ryuqq.mnemo.mediator.partition;
