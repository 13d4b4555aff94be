package enricher.cli;

import enricher.service.ColumnProfiler;

import java.util.List;

/**
 * Box-drawn text table. Columns are as wide as their widest cell, capped at an
 * equal share of {@code maxWidth}.
 */
final class ConsoleTable {

    private ConsoleTable() {
    }

    static String render(List<String> headers, List<List<String>> rows, int maxWidth) {
        if (headers.isEmpty() || rows.isEmpty())
            return "";

        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = headers.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < row.size() && i < widths.length; i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        int cap = Math.max(3, maxWidth / headers.size());
        for (int i = 0; i < widths.length; i++) {
            widths[i] = Math.min(widths[i], cap);
        }

        StringBuilder sb = new StringBuilder();
        border(sb, widths, '┌', '┬', '┐');
        line(sb, widths, headers);
        border(sb, widths, '├', '┼', '┤');
        for (List<String> row : rows) {
            line(sb, widths, row);
        }
        border(sb, widths, '└', '┴', '┘');
        sb.setLength(sb.length() - 1);
        return sb.toString();
    }

    private static void border(StringBuilder sb, int[] widths, char left, char mid, char right) {
        sb.append(left);
        for (int i = 0; i < widths.length; i++) {
            sb.append("─".repeat(widths[i] + 2));
            if (i < widths.length - 1)
                sb.append(mid);
        }
        sb.append(right).append('\n');
    }

    private static void line(StringBuilder sb, int[] widths, List<String> cells) {
        sb.append('│');
        for (int i = 0; i < widths.length; i++) {
            String cell = i < cells.size() ? cells.get(i) : "";
            String text = ColumnProfiler.truncate(cell, widths[i]);
            sb.append(' ').append(text).append(" ".repeat(Math.max(0, widths[i] - text.length()))).append(" │");
        }
        sb.append('\n');
    }
}
