/**
 * Expression trees for restrictions, projections and function calls.
 *
 * <p>Predicates are plain data: backends can walk them to translate a restriction
 * and fall back to in-memory evaluation for the rest.</p>
 *
 * @since 1.0.0
 * @author Mnemo Team
 */
package com.ryuqq.mnemo.core.expr;
