package com.watchflixx.gateway.core.metrics;

import java.util.regex.Pattern;

/**
 * 把路径中的参数段替换为 ":id"，使同一接口的请求归入同一分组
 *
 * <p>按路径段整体匹配 UUID、纯数字和 24 位十六进制 ID，段内部分匹配不替换。
 */
public final class PathNormalizer {

    public static final String PLACEHOLDER = ":id";

    private static final Pattern UUID = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final Pattern NUMERIC = Pattern.compile("\\d+");
    private static final Pattern OBJECT_ID = Pattern.compile("[0-9a-fA-F]{24}");

    private PathNormalizer() {
    }

    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        int query = path.indexOf('?');
        String raw = query >= 0 ? path.substring(0, query) : path;
        String[] segments = raw.split("/", -1);
        StringBuilder normalized = new StringBuilder(raw.length());
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                normalized.append('/');
            }
            normalized.append(isIdentifier(segments[i]) ? PLACEHOLDER : segments[i]);
        }
        return normalized.length() == 0 ? "/" : normalized.toString();
    }

    private static boolean isIdentifier(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        return NUMERIC.matcher(segment).matches()
                || UUID.matcher(segment).matches()
                || OBJECT_ID.matcher(segment).matches();
    }
}
