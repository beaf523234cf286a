package com.ecolang.script.parser;

import java.util.List;

import com.ecolang.script.parser.Interpreter.ReturnSignal;
import com.ecolang.script.parser.Statement.FuncStmt;
import com.ecolang.script.parser.Statement.Stmt;

/** A {@code func} definition registered for the rest of the run. Never mutated. */
public class UserFunction {
    final String name;
    final List<String> params;
    final List<Stmt> body;
    final FuncStmt definition;

    UserFunction(FuncStmt definition) {
        this.name = definition.name;
        this.params = definition.params;
        this.body = definition.body;
        this.definition = definition;
    }

    int arity() {
        return params.size();
    }

    /**
     * Runs the body in a fresh frame that sees only its parameters and the
     * caller's runtime signals. Arity is checked by the caller.
     */
    Value call(Interpreter interpreter, List<Value> args) {
        Environment previous = interpreter.env;
        interpreter.env = previous.newFrame();
        try {
            for (int i = 0; i < params.size(); i++) {
                interpreter.env.define(params.get(i), args.get(i));
            }
            try {
                interpreter.executeBlock(body);
            } catch (ReturnSignal rs) {
                return rs.value;
            }
            return Value.none();
        } finally {
            interpreter.env = previous;
        }
    }
}
