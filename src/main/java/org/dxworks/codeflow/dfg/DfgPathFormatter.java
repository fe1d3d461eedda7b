package org.dxworks.codeflow.dfg;

import org.dxworks.codeflow.model.DfgPath;
import org.dxworks.codeflow.model.FileFlowAnalysis;
import org.dxworks.codeflow.model.ProcedureFlow;

import java.util.List;
import java.util.Map;

/**
 * Text rendering of data-flow paths:
 * <pre>
 * Variable: x
 *   Path 1: (x, 1) -> (x, 3)
 *
 * Variable: y
 *   Path 2: (y, 2)
 * </pre>
 * Paths are numbered across groups.
 */
public final class DfgPathFormatter {

    private DfgPathFormatter() {
    }

    public static String format(List<DfgPath> paths) {
        StringBuilder out = new StringBuilder();
        int index = 1;
        for (DfgPath path : paths) {
            out.append("Path ").append(index++).append(": ").append(path).append('\n');
        }
        return out.toString();
    }

    /** Renders groups of paths; any element whose {@code toString} is a rendered path will do. */
    public static String formatGrouped(Map<String, ? extends List<?>> grouped) {
        StringBuilder out = new StringBuilder();
        int index = 1;
        boolean first = true;
        for (Map.Entry<String, ? extends List<?>> group : grouped.entrySet()) {
            if (!first) {
                out.append('\n');
            }
            first = false;
            out.append("Variable: ").append(group.getKey()).append('\n');
            for (Object path : group.getValue()) {
                out.append("  Path ").append(index++).append(": ").append(path).append('\n');
            }
        }
        return out.toString();
    }

    /** One section per procedure, nested procedures after their parent, blank line between sections. */
    public static String formatReport(FileFlowAnalysis analysis) {
        StringBuilder out = new StringBuilder();
        for (ProcedureFlow procedure : analysis.procedures) {
            appendProcedure(out, procedure);
        }
        return out.toString();
    }

    private static void appendProcedure(StringBuilder out, ProcedureFlow procedure) {
        if (out.length() > 0) {
            out.append('\n');
        }
        out.append("Function ").append(procedure.name).append('\n');
        out.append(formatGrouped(procedure.dataFlowPaths));
        for (ProcedureFlow nested : procedure.nestedProcedures) {
            appendProcedure(out, nested);
        }
    }
}
