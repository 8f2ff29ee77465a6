package org.tova.compiler.backend.emit.features;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.IEmissionRule;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.CallNode;
import org.tova.compiler.frontend.parser.ast.LambdaNode;
import org.tova.compiler.frontend.parser.ast.MemberAccessNode;
import org.tova.compiler.frontend.parser.ast.NamedArgumentNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers calls. Named arguments are collected into one trailing object literal and
 * {@code Foo.new(args)} becomes a constructor call.
 */
public class CallEmissionRule implements IEmissionRule<CallNode> {

    @Override
    public String emit(CallNode node, BaseCodegen gen) {
        String args = arguments(node.arguments(), gen);
        if (node.callee() instanceof MemberAccessNode member && !member.optional() && member.property().equals("new")) {
            return "new " + gen.expression(member.object()) + "(" + args + ")";
        }
        String callee = gen.expression(node.callee());
        if (node.callee() instanceof LambdaNode) callee = "(" + callee + ")";
        return callee + "(" + args + ")";
    }

    /**
     * @param arguments Call arguments, positional and named.
     * @param gen The backend.
     * @return The JavaScript argument list.
     */
    public static String arguments(List<AstNode> arguments, BaseCodegen gen) {
        List<String> positional = new ArrayList<>();
        List<String> named = new ArrayList<>();
        for (AstNode argument : arguments) {
            if (argument instanceof NamedArgumentNode namedArg) {
                named.add(ExpressionRules.key(namedArg.name()) + ": " + gen.expression(namedArg.value()));
            } else {
                positional.add(gen.expression(argument));
            }
        }
        if (!named.isEmpty()) positional.add("{ " + String.join(", ", named) + " }");
        return String.join(", ", positional);
    }
}
