package com.qubular.spotify;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;

public class URIHelper {
    public static Map<String, String> getQueryParams(URI uri) {
        if (uri.getRawQuery() == null || uri.getRawQuery().isEmpty()) {
            return Collections.emptyMap();
        }
        return Arrays.stream(uri.getRawQuery().split("&"))
                .map(Pattern.compile("(.*?)=(.*)")::matcher)
                .filter(Matcher::matches)
                .collect(Collectors.toMap(m -> URLDecoder.decode(m.group(1), UTF_8),
                        m -> URLDecoder.decode(m.group(2), UTF_8),
                        (a, b) -> b,
                        LinkedHashMap::new));
    }

    public static String generateQueryParamsForURI(Map<String, String> queryParams) {
        return queryParams.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), UTF_8).replaceAll("\\+","%20") +
                        "=" +
                        URLEncoder.encode(e.getValue(), UTF_8).replaceAll("\\+", "%20"))
                .collect(Collectors.joining("&"));
    }

    /**
     * @return the uri with the given query parameter added, or replaced if already present.
     */
    public static URI withQueryParam(URI uri, String name, String value) {
        Map<String, String> queryParams = new LinkedHashMap<>(getQueryParams(uri));
        queryParams.put(name, value);
        return replaceQuery(uri, queryParams);
    }

    public static URI withoutQueryParam(URI uri, String name) {
        Map<String, String> queryParams = new LinkedHashMap<>(getQueryParams(uri));
        queryParams.remove(name);
        return replaceQuery(uri, queryParams);
    }

    private static URI replaceQuery(URI uri, Map<String, String> queryParams) {
        String base = uri.toString();
        int queryStart = base.indexOf('?');
        if (queryStart >= 0) {
            base = base.substring(0, queryStart);
        }
        return queryParams.isEmpty() ? URI.create(base) : URI.create(base + "?" + generateQueryParamsForURI(queryParams));
    }
}
