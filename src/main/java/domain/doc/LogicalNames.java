package domain.doc;

import java.util.Locale;

/** {@code TXN_TYPE} -> {@code Txn Type}. */
public final class LogicalNames {

    private LogicalNames() {
    }

    public static String of(String columnName) {
        if (columnName == null || columnName.isBlank()) return "";

        StringBuilder out = new StringBuilder(columnName.length());
        for (String part : columnName.trim().split("_")) {
            if (part.isEmpty()) continue;
            if (out.length() > 0) out.append(' ');
            out.append(Character.toUpperCase(part.charAt(0)))
                    .append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return out.toString();
    }
}
