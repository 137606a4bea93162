package domain.doc;

import java.util.regex.Pattern;

/**
 * R3 when the expression is empty, {@code null}, or a single (optionally qualified) identifier;
 * R3+ otherwise.
 */
public final class TransformationClassifier {

    private static final Pattern IDENTIFIER_CHAIN =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private TransformationClassifier() {
    }

    public static TransformationClass classify(String expression) {
        String e = expression == null ? "" : expression.trim();
        if (e.isEmpty() || e.equalsIgnoreCase("null")) return TransformationClass.R3;
        if (IDENTIFIER_CHAIN.matcher(e).matches()) return TransformationClass.R3;
        return TransformationClass.R3_PLUS;
    }
}
