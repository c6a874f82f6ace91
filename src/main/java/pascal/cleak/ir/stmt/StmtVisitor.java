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

/**
 * Stmt visitor which may return a result after the visit.
 *
 * @param <T> type of the return value
 */
public interface StmtVisitor<T> {

    default T visit(Block stmt) {
        return visitDefault(stmt);
    }

    default T visit(DeclStmt stmt) {
        return visitDefault(stmt);
    }

    default T visit(AssignStmt stmt) {
        return visitDefault(stmt);
    }

    default T visit(ExpStmt stmt) {
        return visitDefault(stmt);
    }

    default T visit(If stmt) {
        return visitDefault(stmt);
    }

    default T visit(Return stmt) {
        return visitDefault(stmt);
    }

    default T visit(Throw stmt) {
        return visitDefault(stmt);
    }

    default T visit(Delete stmt) {
        return visitDefault(stmt);
    }

    default T visit(Goto stmt) {
        return visitDefault(stmt);
    }

    default T visit(Label stmt) {
        return visitDefault(stmt);
    }

    default T visit(Break stmt) {
        return visitDefault(stmt);
    }

    default T visit(Continue stmt) {
        return visitDefault(stmt);
    }

    default T visit(LoopStmt stmt) {
        return visitDefault(stmt);
    }

    default T visit(Try stmt) {
        return visitDefault(stmt);
    }

    default T visitDefault(Stmt stmt) {
        return null;
    }
}
