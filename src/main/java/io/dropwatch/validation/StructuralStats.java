package io.dropwatch.validation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line, function and empty-function counts. A heuristic signal only; it never rejects a deposit.
 */
public record StructuralStats(int lines, int functions, int emptyFunctions) {
    private static final Pattern PY_DEF =
            Pattern.compile("^(\\s*)(?:async\\s+)?def\\s+\\w+\\s*\\(.*\\)\\s*(?:->\\s*[^:]+)?:\\s*(.*)$");
    private static final Pattern JS_FUNCTION =
            Pattern.compile("\\bfunction\\b[^(]*\\(|\\)\\s*=>\\s*\\{");
    private static final Pattern JAVA_METHOD = Pattern.compile(
            "^\\s*(?:(?:public|private|protected|static|final|synchronized|abstract|default)\\s+)+"
                    + "[\\w<>\\[\\],.?\\s]+?\\s+\\w+\\s*\\([^)]*\\)\\s*(?:throws\\s+[\\w.,\\s]+)?\\{");
    private static final int MAX_BODY_LINES = 50;

    /**
     * Returns {@code null} for languages without a recognizable function syntax.
     */
    public static StructuralStats analyze(String fileName, List<String> lines) {
        String name = fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".py")) {
            return python(lines);
        }
        if (name.endsWith(".js") || name.endsWith(".ts") || name.endsWith(".java")) {
            return braces(lines, name.endsWith(".java") ? JAVA_METHOD : JS_FUNCTION);
        }
        return null;
    }

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("lines", lines);
        row.put("functions", functions);
        row.put("empty_functions", emptyFunctions);
        return row;
    }

    static StructuralStats python(List<String> lines) {
        int functions = 0;
        int empty = 0;
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = PY_DEF.matcher(lines.get(i));
            if (!m.matches()) {
                continue;
            }
            functions++;
            String inline = stripPyComment(m.group(2));
            if (!inline.isEmpty()) {
                if (isPyPlaceholder(inline)) {
                    empty++;
                }
                continue;
            }
            int defIndent = m.group(1).length();
            int first = nextPyStatement(lines, i + 1);
            if (first < 0 || indent(lines.get(first)) <= defIndent) {
                continue;
            }
            if (!isPyPlaceholder(lines.get(first).strip())) {
                continue;
            }
            int after = nextPyStatement(lines, first + 1);
            if (after < 0 || indent(lines.get(after)) <= defIndent) {
                empty++;
            }
        }
        return new StructuralStats(lines.size(), functions, empty);
    }

    static StructuralStats braces(List<String> lines, Pattern declaration) {
        int functions = 0;
        int empty = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher m = declaration.matcher(line);
            if (!m.find()) {
                continue;
            }
            int open = line.indexOf('{', m.start());
            if (open < 0) {
                continue;
            }
            functions++;
            if (bodyIsEmpty(lines, i, open)) {
                empty++;
            }
        }
        return new StructuralStats(lines.size(), functions, empty);
    }

    private static boolean bodyIsEmpty(List<String> lines, int startLine, int openIdx) {
        StringBuilder body = new StringBuilder();
        int depth = 0;
        int last = Math.min(lines.size(), startLine + MAX_BODY_LINES);
        for (int i = startLine; i < last; i++) {
            String line = lines.get(i);
            int from = i == startLine ? openIdx : 0;
            for (int j = from; j < line.length(); j++) {
                char ch = line.charAt(j);
                if (ch == '{') {
                    depth++;
                    if (depth == 1) {
                        continue;
                    }
                } else if (ch == '}') {
                    depth--;
                    if (depth == 0) {
                        return stripBraceComments(body.toString()).isBlank();
                    }
                }
                body.append(ch);
            }
            body.append('\n');
        }
        return false;
    }

    private static String stripBraceComments(String body) {
        return body.replaceAll("(?s)/\\*.*?\\*/", "").replaceAll("//[^\\n]*", "");
    }

    private static boolean isPyPlaceholder(String statement) {
        String s = stripPyComment(statement);
        return s.equals("pass") || s.equals("...");
    }

    private static String stripPyComment(String s) {
        int hash = s.indexOf('#');
        return (hash >= 0 ? s.substring(0, hash) : s).strip();
    }

    private static int nextPyStatement(List<String> lines, int from) {
        for (int i = from; i < lines.size(); i++) {
            String s = lines.get(i).strip();
            if (s.isEmpty() || s.startsWith("#")) {
                continue;
            }
            if ((s.startsWith("\"\"\"") || s.startsWith("'''")) && s.length() >= 6
                    && (s.endsWith("\"\"\"") || s.endsWith("'''"))) {
                continue;
            }
            return i;
        }
        return -1;
    }

    private static int indent(String line) {
        int n = 0;
        while (n < line.length() && Character.isWhitespace(line.charAt(n))) {
            n++;
        }
        return n;
    }
}
