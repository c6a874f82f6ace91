/*
 * CLeak: A Resource-Ownership Checker for C/C++
 *
 * Copyright (C) 2022 Tian Tan <tiantan@nju.edu.cn>
 * Copyright (C) 2022 Yue Li <yueli@nju.edu.cn>
 *
 * This file is part of CLeak.
 *
 * CLeak is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License
 * as published by the Free Software Foundation, either version 3
 * of the License, or (at your option) any later version.
 *
 * CLeak is distributed in the hope that it will be useful,but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY
 * or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General
 * Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public
 * License along with CLeak. If not, see <https://www.gnu.org/licenses/>.
 */

package pascal.cleak.analysis.leak;

import pascal.cleak.diagnostic.Certainty;
import pascal.cleak.diagnostic.Diagnostic;
import pascal.cleak.diagnostic.Diagnostics;
import pascal.cleak.diagnostic.ErrorKind;
import pascal.cleak.diagnostic.Location;
import pascal.cleak.diagnostic.Severity;
import pascal.cleak.ir.Node;
import pascal.cleak.ir.exp.CallExp;
import pascal.cleak.library.Library;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the diagnostics of one run of the leak checker.
 */
class LeakReporter {

    private final String function;

    private final Library library;

    private final boolean checkLibrary;

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    LeakReporter(String function, Library library, boolean checkLibrary) {
        this.function = function;
        this.library = library;
        this.checkLibrary = checkLibrary;
    }

    void leak(Node node, String varName, int family) {
        if (library.isResource(family)) {
            report(ErrorKind.LEAK, "resourceLeak", Severity.ERROR, 775,
                    "Resource leak: " + varName, node);
        } else {
            report(ErrorKind.LEAK, "memleak", Severity.ERROR, 401,
                    "Memory leak: " + varName, node);
        }
    }

    void mismatch(Node dealloc, Node alloc, String varName) {
        report(ErrorKind.MISMATCH, "mismatchAllocDealloc", Severity.ERROR, 762,
                "Mismatching allocation and deallocation: " + varName, alloc, dealloc);
    }

    void doubleFree(Node node, Node previous, String varName, int family) {
        String message = library.isResource(family)
                ? "Resource handle '" + varName + "' freed twice."
                : "Memory pointed to by '" + varName + "' is freed twice.";
        report(ErrorKind.DOUBLE_FREE, "doubleFree", Severity.ERROR, 415,
                message, previous, node);
    }

    void deallocUse(Node node, String varName) {
        report(ErrorKind.DEALLOCATED_USE, "deallocuse", Severity.ERROR, 416,
                "Dereferencing '" + varName + "' after it is deallocated / released", node);
    }

    void deallocReturn(Node node, Node dealloc, String varName) {
        report(ErrorKind.DEALLOCATED_RETURN, "deallocret", Severity.ERROR, 672,
                "Returning/dereferencing '" + varName + "' after it is deallocated / released",
                dealloc, node);
    }

    void limit(AnalysisLimitException e) {
        report(ErrorKind.ANALYSIS_LIMIT_EXCEEDED, "internalLimit", Severity.ERROR, 0,
                e.getMessage(), e.getNode());
    }

    /**
     * Notes that the callee of a possible usage lacks library metadata.
     */
    void configurationInfo(Node node, Usage usage) {
        if (!checkLibrary || usage.kind() != Usage.Kind.USED) {
            return;
        }
        CallExp call = usage.call();
        if (call.getFunction() != null && call.getFunction().hasBody()) {
            return;
        }
        String name = library.getFunctionName(call);
        if (name.isEmpty()) {
            name = "unknown::" + call.getName();
        }
        report(ErrorKind.CONFIGURATION_INFO, "checkLibraryUseIgnore", Severity.INFORMATION, 0,
                "--check-library: Function " + name
                        + "() should have <use>/<leak-ignore> configuration", node);
    }

    private void report(ErrorKind kind, String id, Severity severity, int cwe,
                        String message, Node... nodes) {
        List<Location> locations = new ArrayList<>();
        for (Node node : nodes) {
            if (node != null) {
                locations.add(Location.of(node));
            }
        }
        diagnostics.add(new Diagnostic(kind, id, severity, locations,
                message, Certainty.NORMAL, cwe, function));
    }

    Diagnostics getDiagnostics() {
        return new Diagnostics(diagnostics);
    }
}
