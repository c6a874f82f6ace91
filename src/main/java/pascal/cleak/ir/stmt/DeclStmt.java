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
import pascal.cleak.ir.exp.Exp;
import pascal.cleak.ir.exp.VarExp;

import java.util.ArrayList;
import java.util.List;

/**
 * Declaration of a local variable, with an optional initializer:
 * {@code T v = init;}, {@code T v(init);} or {@code T v{init};}.
 */
public class DeclStmt extends AbstractStmt {

    public enum InitStyle {
        ASSIGN,
        PAREN,
        BRACE,
    }

    private final VarExp declarator;

    private final Exp initializer;

    private final InitStyle initStyle;

    public DeclStmt(int lineNumber, VarExp declarator,
                    Exp initializer, InitStyle initStyle) {
        super(lineNumber);
        this.declarator = declarator;
        this.initializer = initializer;
        this.initStyle = initStyle;
    }

    public VarExp getDeclarator() {
        return declarator;
    }

    public Var getVar() {
        return declarator.getVar();
    }

    /**
     * @return the initializer, or null if there is none.
     */
    public Exp getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    public InitStyle getInitStyle() {
        return initStyle;
    }

    @Override
    public Category getCategory() {
        return Category.NAME;
    }

    @Override
    public String getText() {
        return declarator.getText();
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(2);
        children.add(declarator);
        if (initializer != null) {
            children.add(initializer);
        }
        return children;
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
