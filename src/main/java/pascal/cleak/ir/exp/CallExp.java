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
import pascal.cleak.ir.Function;
import pascal.cleak.ir.Node;
import pascal.cleak.ir.type.TypeRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Function call, member function call or constructor call.
 * <p>
 * Constructor calls, e.g., {@code std::unique_ptr<T>(p)} or the
 * initializer of {@code std::unique_ptr<T> sp(p)}, carry the type
 * being constructed.
 */
public class CallExp extends AbstractNode implements Exp {

    /**
     * Possibly qualified name of the callee, e.g., {@code free}
     * or {@code std::unique_ptr}.
     */
    private final String name;

    /**
     * Object on which a member function is called, or null.
     */
    private final Exp receiver;

    private final boolean arrow;

    private final List<Exp> templateArgs;

    private final List<Exp> args;

    private final TypeRef constructedType;

    private final Function function;

    public CallExp(int lineNumber, String name, Exp receiver, boolean arrow,
                   List<Exp> templateArgs, List<Exp> args,
                   TypeRef constructedType, Function function) {
        super(lineNumber);
        this.name = name;
        this.receiver = receiver;
        this.arrow = arrow;
        this.templateArgs = List.copyOf(templateArgs);
        this.args = List.copyOf(args);
        this.constructedType = constructedType;
        this.function = function;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the name without namespace or class qualifiers.
     */
    public String getSimpleName() {
        int i = name.lastIndexOf("::");
        return i < 0 ? name : name.substring(i + 2);
    }

    public Exp getReceiver() {
        return receiver;
    }

    /**
     * @return true if the member function is called via {@code ->}.
     */
    public boolean isArrow() {
        return arrow;
    }

    public List<Exp> getTemplateArgs() {
        return templateArgs;
    }

    public List<Exp> getArgs() {
        return args;
    }

    public int getArgCount() {
        return args.size();
    }

    /**
     * @param i 0-based position of the argument
     */
    public Exp getArg(int i) {
        return args.get(i);
    }

    public boolean isConstructor() {
        return constructedType != null;
    }

    public TypeRef getConstructedType() {
        return constructedType;
    }

    /**
     * @return the resolved callee, or null if it cannot be resolved.
     */
    public Function getFunction() {
        return function;
    }

    @Override
    public Category getCategory() {
        return Category.NAME;
    }

    @Override
    public String getText() {
        return name;
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>();
        if (receiver != null) {
            children.add(receiver);
        }
        children.addAll(templateArgs);
        children.addAll(args);
        return children;
    }
}
