package org.shale.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Value
@Builder(toBuilder = true)
public class ColumnModel {
    private static final Pattern DEFAULT_KEYWORD = Pattern.compile("(?i)\\bDEFAULT\\s+");

    String name;
    @Builder.Default ColumnType type = ColumnType.NULL;
    @Singular List<String> constraints; // 선언 순서 유지 (DDL 생성 순서)

    public static ColumnModel of(String name, ColumnType type, List<String> constraints) {
        return ColumnModel.builder()
                .name(name)
                .type(type)
                .constraints(constraints)
                .build();
    }

    public ColumnModel renamedTo(String newName) {
        return toBuilder().name(newName).build();
    }

    public ColumnModel withType(ColumnType newType) {
        return toBuilder().type(newType).build();
    }

    public ColumnModel withConstraints(List<String> newConstraints) {
        return toBuilder().clearConstraints().constraints(newConstraints).build();
    }

    /**
     * Whether any constraint clause contains the given keyword sequence, ignoring case and
     * repeated whitespace ("NOT NULL" matches "not   null").
     */
    public boolean hasConstraintKeyword(String keyword) {
        Pattern p = Pattern.compile("(?i)\\b" + keyword.trim().replaceAll("\\s+", "\\\\s+") + "\\b");
        return constraints.stream().anyMatch(c -> p.matcher(c).find());
    }

    /**
     * The default value expression declared by the first {@code DEFAULT} clause, as written.
     */
    public Optional<String> findDefaultValue() {
        for (String clause : constraints) {
            Matcher m = DEFAULT_KEYWORD.matcher(clause);
            if (m.find()) {
                String value = readDefaultToken(clause.substring(m.end()));
                if (!value.isEmpty()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    private static String readDefaultToken(String rest) {
        if (rest.isEmpty()) {
            return "";
        }
        char first = rest.charAt(0);
        if (first == '(') {
            int depth = 0;
            for (int i = 0; i < rest.length(); i++) {
                char ch = rest.charAt(i);
                if (ch == '(') depth++;
                else if (ch == ')' && --depth == 0) return rest.substring(0, i + 1);
            }
            return rest;
        }
        if (first == '\'' || first == '"') {
            int i = 1;
            while (i < rest.length()) {
                if (rest.charAt(i) == first) {
                    // '' 는 이스케이프된 따옴표
                    if (i + 1 < rest.length() && rest.charAt(i + 1) == first) {
                        i += 2;
                        continue;
                    }
                    return rest.substring(0, i + 1);
                }
                i++;
            }
            return rest;
        }
        int end = 0;
        while (end < rest.length() && !Character.isWhitespace(rest.charAt(end))) {
            end++;
        }
        return rest.substring(0, end);
    }

    @JsonIgnore
    public boolean isNotNull() {
        return hasConstraintKeyword("NOT NULL");
    }

    @JsonIgnore
    public boolean isUnique() {
        return hasConstraintKeyword("UNIQUE");
    }
}
