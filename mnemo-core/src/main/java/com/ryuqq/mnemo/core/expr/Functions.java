package com.ryuqq.mnemo.core.expr;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * {@link Call} 노드가 사용하는 함수 테이블.
 *
 * <p>문자열 함수는 대상이 null이면 null을 반환합니다 (판별 함수는 false).</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class Functions {

    public static final String IS_NULL = "isNull";
    public static final String NOT_NULL = "notNull";
    public static final String STARTS_WITH = "startsWith";
    public static final String ENDS_WITH = "endsWith";
    public static final String CONTAINS = "contains";
    public static final String LOWER = "lower";
    public static final String UPPER = "upper";
    public static final String LENGTH = "length";
    public static final String IN = "in";

    private static final Map<String, Function<List<Object>, Object>> TABLE;

    static {
        Map<String, Function<List<Object>, Object>> table = new LinkedHashMap<>();
        table.put(IS_NULL, args -> arg(args, 0) == null);
        table.put(NOT_NULL, args -> arg(args, 0) != null);
        table.put(STARTS_WITH, args -> {
            Object subject = arg(args, 0);
            Object prefix = arg(args, 1);
            return subject != null && prefix != null && subject.toString().startsWith(prefix.toString());
        });
        table.put(ENDS_WITH, args -> {
            Object subject = arg(args, 0);
            Object suffix = arg(args, 1);
            return subject != null && suffix != null && subject.toString().endsWith(suffix.toString());
        });
        table.put(CONTAINS, args -> {
            Object subject = arg(args, 0);
            Object element = arg(args, 1);
            if (subject instanceof Collection) {
                return ((Collection<?>) subject).stream().anyMatch(item -> Values.equal(item, element));
            }
            return subject != null && element != null && subject.toString().contains(element.toString());
        });
        table.put(LOWER, args -> {
            Object subject = arg(args, 0);
            return subject == null ? null : subject.toString().toLowerCase(Locale.ROOT);
        });
        table.put(UPPER, args -> {
            Object subject = arg(args, 0);
            return subject == null ? null : subject.toString().toUpperCase(Locale.ROOT);
        });
        table.put(LENGTH, args -> {
            Object subject = arg(args, 0);
            if (subject instanceof Collection) {
                return ((Collection<?>) subject).size();
            }
            return subject == null ? null : subject.toString().length();
        });
        table.put(IN, args -> {
            Object subject = arg(args, 0);
            Object candidates = arg(args, 1);
            if (!(candidates instanceof Collection)) {
                return false;
            }
            return ((Collection<?>) candidates).stream().anyMatch(item -> Values.equal(item, subject));
        });
        TABLE = Collections.unmodifiableMap(table);
    }

    private Functions() {
    }

    /**
     * @return names of every supported function
     */
    public static Set<String> names() {
        return TABLE.keySet();
    }

    /**
     * @param name function name
     * @return true if supported
     */
    public static boolean isKnown(String name) {
        return name != null && TABLE.containsKey(name);
    }

    /**
     * Applies a function to already evaluated arguments.
     *
     * @param name function name
     * @param args argument values
     * @return result
     * @throws IllegalArgumentException if the function is unknown
     */
    public static Object apply(String name, List<Object> args) {
        Function<List<Object>, Object> function = TABLE.get(name);
        if (function == null) {
            throw new IllegalArgumentException("Unknown function: " + name);
        }
        return function.apply(args);
    }

    private static Object arg(List<Object> args, int index) {
        if (index >= args.size()) {
            throw new IllegalArgumentException("Missing argument " + index);
        }
        return args.get(index);
    }
}
