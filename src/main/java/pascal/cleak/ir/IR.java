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

package pascal.cleak.ir;

import pascal.cleak.ir.exp.LambdaExp;
import pascal.cleak.ir.stmt.Block;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Program representation of one function: its descriptor, the syntax
 * graph holding all of its nodes, its body and the variables it declares.
 */
public class IR {

    private final Function function;

    private final SyntaxGraph graph;

    private final Block body;

    private final Map<Integer, Var> vars;

    private final boolean cpp;

    public IR(Function function, SyntaxGraph graph, Block body,
              List<Var> vars, boolean cpp) {
        this.function = function;
        this.graph = graph;
        this.body = body;
        Map<Integer, Var> varMap = new LinkedHashMap<>();
        vars.forEach(v -> varMap.put(v.getId(), v));
        this.vars = Collections.unmodifiableMap(varMap);
        this.cpp = cpp;
    }

    public Function getFunction() {
        return function;
    }

    public SyntaxGraph getGraph() {
        return graph;
    }

    public Block getBody() {
        return body;
    }

    /**
     * @return the variable of the given id, or null if it is not
     * declared in this function.
     */
    public Var getVar(int id) {
        return vars.get(id);
    }

    public List<Var> getVars() {
        return List.copyOf(vars.values());
    }

    public List<Var> getParams() {
        return vars.values().stream().filter(Var::isArgument).toList();
    }

    /**
     * @return true if the function is written in C++.
     */
    public boolean isCpp() {
        return cpp;
    }

    /**
     * @return true if the function contains a lambda or a local
     * function body.
     */
    public boolean hasInlineOrLambda() {
        for (Node node : graph) {
            if (node instanceof LambdaExp) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "IR{" + function + "}";
    }
}
