package db.parts.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import db.parts.config.PartsConfig;
import db.parts.model.SystemPart;

/**
 * Simple ASCII table printer for system.parts rows.
 * Adds approx_rows and in_use columns derived through {@link PartsConfig}.
 */
public final class PartsTablePrinter {
    private static final String[] HEADERS = {
        "database", "table", "partition", "name", "active", "marks", "approx_rows", "bytes", "refcount", "in_use", "modification_time"
    };

    private PartsTablePrinter() {}

    public static void print(List<SystemPart> parts, PartsConfig config, PrintStream out) {
        if (parts == null || parts.isEmpty()) {
            out.println("(0 row(s))");
            return;
        }
        List<String[]> rows = new ArrayList<>(parts.size());
        for (SystemPart p : parts) rows.add(cells(p, config));

        int[] widths = new int[HEADERS.length];
        for (int i = 0; i < HEADERS.length; i++) widths[i] = HEADERS[i].length();
        for (String[] r : rows) {
            for (int i = 0; i < r.length; i++) {
                if (r[i].length() > widths[i]) widths[i] = r[i].length();
            }
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildRow(HEADERS, widths));
        out.println(divLine);
        for (String[] r : rows) {
            out.println(buildRow(r, widths));
        }
        out.println(divLine);
        out.println("(" + rows.size() + " row(s))");
    }

    private static String[] cells(SystemPart p, PartsConfig config) {
        return new String[] {
            String.valueOf(p.database()),
            String.valueOf(p.table()),
            String.valueOf(p.partition()),
            String.valueOf(p.name()),
            String.valueOf(p.active()),
            String.valueOf(p.marks()),
            String.valueOf(p.approximateRows(config.indexGranularity())),
            String.valueOf(p.bytes()),
            String.valueOf(p.refcount()),
            String.valueOf(p.isInUse(config.inUseRefcount())),
            String.valueOf(p.modificationTime())
        };
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildRow(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(pad(cells[i], widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
