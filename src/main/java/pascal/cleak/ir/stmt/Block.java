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

package pascal.cleak.ir.stmt;

import pascal.cleak.ir.Category;
import pascal.cleak.ir.Node;
import pascal.cleak.ir.Var;

import java.util.ArrayList;
import java.util.List;

/**
 * Brace-enclosed sequence of statements, which opens a scope.
 */
public class Block extends AbstractStmt {

    private final List<Stmt> stmts;

    private final ScopeEnd end;

    public Block(int lineNumber, List<Stmt> stmts, ScopeEnd end) {
        super(lineNumber);
        this.stmts = List.copyOf(stmts);
        this.end = end;
    }

    public List<Stmt> getStmts() {
        return stmts;
    }

    public boolean isEmpty() {
        return stmts.isEmpty();
    }

    public ScopeEnd getEnd() {
        return end;
    }

    /**
     * @return true if the given variable is declared directly in this
     * block, i.e., its scope ends at {@link #getEnd()}.
     */
    public boolean declares(Var var) {
        for (Stmt stmt : stmts) {
            if (stmt instanceof DeclStmt decl && decl.getVar() == var) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Category getCategory() {
        return Category.OPERATOR;
    }

    @Override
    public String getText() {
        return "{";
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(stmts);
        children.add(end);
        return children;
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
