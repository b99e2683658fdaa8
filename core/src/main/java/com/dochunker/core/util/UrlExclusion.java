package com.dochunker.core.util;

import java.net.URI;
import java.util.List;
import java.util.regex.Pattern;

public final class UrlExclusion {
    private UrlExclusion(){}

    /**
     * URL의 경로(path, 디코딩 기준)에 대해 검사한다. patterns 지원:
     * <ul>
     *   <li>접두(prefix): {@code "/extensions/"}</li>
     *   <li>부분 문자열: {@code "contains:"} 접두 (예: {@code contains:Special:})</li>
     *   <li>glob: {@code '*'}, {@code '?'} 포함
     *       (예: {@code "/skins/*"}, {@code "*.php"})
     *   </li>
     *   <li>정규식: {@code "re:"} 접두 (예: {@code re:/index\.php/.*:.*})</li>
     * </ul>
     */
    public static boolean isExcluded(URI url, List<String> patterns){
        if (url == null || patterns == null || patterns.isEmpty()) return false;
        final String path = (url.getPath() == null) ? "" : url.getPath();
        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;

            if (p.startsWith("re:")) {
                // 정규식
                String rx = p.substring(3);
                if (Pattern.compile(rx).matcher(path).find()) return true;

            } else if (p.startsWith("contains:")) {
                // 부분 문자열 (대소문자 구분: "Special:" 네임스페이스 표기 그대로)
                if (path.contains(p.substring("contains:".length()))) return true;

            } else if (p.indexOf('*') >= 0 || p.indexOf('?') >= 0) {
                // glob: 경로 전체 매치
                if (Pattern.compile(globToRegex(p)).matcher(path).matches()) return true;

            } else {
                // prefix
                if (path.startsWith(p)) return true;
            }
        }
        return false;
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch(c){
                case '*': r.append(".*"); break;
                case '?': r.append('.'); break;
                case '.': case '\\': case '+': case '(': case ')':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        return r.toString();
    }
}
