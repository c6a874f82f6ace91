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

package pascal.cleak.ir.exp;

import pascal.cleak.ir.AbstractNode;
import pascal.cleak.ir.Category;
import pascal.cleak.ir.Node;
import pascal.cleak.ir.type.TypeRef;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code new T(args)}, {@code new T[n]}, {@code new (std::nothrow) T}
 * or placement {@code new (buf) T}.
 */
public class NewExp extends AbstractNode implements Exp {

    private final TypeRef type;

    /**
     * Length of the allocated array, or null for scalar new.
     */
    private final Exp length;

    private final List<Exp> args;

    private final List<Exp> placementArgs;

    private final boolean nothrow;

    public NewExp(int lineNumber, TypeRef type, Exp length, List<Exp> args,
                  List<Exp> placementArgs, boolean nothrow) {
        super(lineNumber);
        this.type = type;
        this.length = length;
        this.args = List.copyOf(args);
        this.placementArgs = List.copyOf(placementArgs);
        this.nothrow = nothrow;
    }

    public TypeRef getType() {
        return type;
    }

    public Exp getLength() {
        return length;
    }

    public boolean isArray() {
        return length != null || type.array();
    }

    public List<Exp> getArgs() {
        return args;
    }

    public boolean isPlacement() {
        return !placementArgs.isEmpty();
    }

    public List<Exp> getPlacementArgs() {
        return placementArgs;
    }

    public boolean isNothrow() {
        return nothrow;
    }

    @Override
    public Category getCategory() {
        return Category.KEYWORD;
    }

    @Override
    public String getText() {
        return "new";
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(placementArgs);
        if (length != null) {
            children.add(length);
        }
        children.addAll(args);
        return children;
    }
}
