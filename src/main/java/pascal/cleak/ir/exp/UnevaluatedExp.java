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

import java.util.List;

/**
 * Operator whose operand is never evaluated at run time.
 */
public class UnevaluatedExp extends AbstractNode implements Exp {

    public enum Kind {
        SIZEOF("sizeof"),
        DECLTYPE("decltype"),
        ALIGNOF("alignof"),
        TYPEID("typeid"),
        ;

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        @Override
        public String toString() {
            return keyword;
        }
    }

    private final Kind kind;

    private final Exp operand;

    public UnevaluatedExp(int lineNumber, Kind kind, Exp operand) {
        super(lineNumber);
        this.kind = kind;
        this.operand = operand;
    }

    public Kind getKind() {
        return kind;
    }

    public Exp getOperand() {
        return operand;
    }

    @Override
    public Category getCategory() {
        return Category.KEYWORD;
    }

    @Override
    public String getText() {
        return kind.toString();
    }

    @Override
    public List<Node> getChildren() {
        return List.of(operand);
    }
}
