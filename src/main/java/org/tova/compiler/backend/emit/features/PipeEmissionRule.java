package org.tova.compiler.backend.emit.features;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.IEmissionRule;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.CallNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.IndexAccessNode;
import org.tova.compiler.frontend.parser.ast.MemberAccessNode;
import org.tova.compiler.frontend.parser.ast.PipeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers {@code left |> right} by rewriting the right-hand side into an ordinary call and emitting that.
 * <ul>
 *   <li>{@code x |> f(_, a)} fills the placeholder: {@code f(x, a)}</li>
 *   <li>{@code x |> f(a)} inserts the value first: {@code f(x, a)}</li>
 *   <li>{@code x |> .m(a)} calls the method on the value: {@code x.m(a)}</li>
 *   <li>{@code x |> f} calls {@code f(x)}</li>
 * </ul>
 * Anything else is applied as a function.
 */
public class PipeEmissionRule implements IEmissionRule<PipeNode> {

    @Override
    public String emit(PipeNode node, BaseCodegen gen) {
        AstNode left = node.left();
        AstNode right = node.right();
        if (hasPlaceholderRoot(right)) {
            return gen.expression(replaceRoot(right, left));
        }
        if (right instanceof CallNode call) {
            List<AstNode> args = new ArrayList<>(call.arguments());
            boolean placeholder = false;
            for (int i = 0; i < args.size(); i++) {
                if (isPlaceholder(args.get(i))) {
                    args.set(i, left);
                    placeholder = true;
                }
            }
            if (!placeholder) args.add(0, left);
            return gen.expression(new CallNode(call.callee(), args, call.loc()));
        }
        if (right instanceof IdentifierNode || right instanceof MemberAccessNode) {
            return gen.expression(new CallNode(right, List.of(left), node.loc()));
        }
        return "(" + gen.expression(right) + ")(" + gen.expression(left) + ")";
    }

    private static boolean isPlaceholder(AstNode node) {
        return node instanceof IdentifierNode id && id.name().equals("_");
    }

    private static boolean hasPlaceholderRoot(AstNode node) {
        if (isPlaceholder(node)) return true;
        if (node instanceof CallNode call) return hasPlaceholderRoot(call.callee());
        if (node instanceof MemberAccessNode member) return hasPlaceholderRoot(member.object());
        if (node instanceof IndexAccessNode index) return hasPlaceholderRoot(index.object());
        return false;
    }

    private static AstNode replaceRoot(AstNode node, AstNode value) {
        if (isPlaceholder(node)) return value;
        if (node instanceof CallNode call) {
            return new CallNode(replaceRoot(call.callee(), value), call.arguments(), call.loc());
        }
        if (node instanceof MemberAccessNode member) {
            return new MemberAccessNode(replaceRoot(member.object(), value), member.property(), member.optional(), member.loc());
        }
        if (node instanceof IndexAccessNode index) {
            return new IndexAccessNode(replaceRoot(index.object(), value), index.index(), index.loc());
        }
        return node;
    }
}
