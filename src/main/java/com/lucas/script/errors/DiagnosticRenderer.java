package com.lucas.script.errors;

/**
 * Plain-text rendering of a {@link LucasError} with a source excerpt:
 *
 * <pre>
 * X Erro de Execução na linha 2, coluna 10:
 *
 *     1 | variavel nome = "Ana"
 *     2 | imprimir nomee
 *                  ^ Variável 'nomee' não definida
 *
 * Dica: Você quis dizer 'nome'?
 * </pre>
 */
public final class DiagnosticRenderer {

    private static final int GUTTER_WIDTH = 7; // " %3d | "

    private DiagnosticRenderer() {}

    public static String render(LucasError error, String source) {
        StringBuilder sb = new StringBuilder();
        sb.append("X ").append(error.kind().title());

        String[] lines = (source == null) ? new String[0] : source.split("\\R", -1);
        SourceLocation loc = error.location();

        if (loc == null || loc.line < 1 || loc.line > lines.length) {
            if (loc != null) sb.append(" na ").append(loc);
            sb.append('\n');
            sb.append("  ").append(error.getMessage()).append('\n');
        } else {
            sb.append(" na linha ").append(loc.line).append(", coluna ").append(loc.column).append(":\n\n");
            int idx = loc.line - 1;
            if (idx > 0) sb.append(gutter(idx)).append(lines[idx - 1]).append('\n');
            sb.append(gutter(loc.line)).append(lines[idx]).append('\n');
            int pad = GUTTER_WIDTH + Math.max(loc.column, 1) - 1;
            sb.append(" ".repeat(pad)).append("^ ").append(error.getMessage()).append('\n');
            if (idx + 1 < lines.length) sb.append(gutter(loc.line + 1)).append(lines[idx + 1]).append('\n');
        }

        if (error.suggestion() != null) {
            sb.append('\n').append("Dica: ").append(error.suggestion()).append('\n');
        }
        return sb.toString();
    }

    private static String gutter(int lineNumber) {
        return String.format(" %3d | ", lineNumber);
    }
}
