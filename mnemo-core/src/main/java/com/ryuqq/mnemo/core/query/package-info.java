/**
 * Relations, joins, sort orders, projections and statements.
 *
 * @since 1.0.0
 * @author Mnemo Team
 */
package com.ryuqq.mnemo.core.query;
