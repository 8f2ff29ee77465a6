package org.tova.compiler.frontend.semantics;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BindingPatternNode;
import org.tova.compiler.frontend.parser.ast.MatchArmNode;
import org.tova.compiler.frontend.parser.ast.MatchNode;
import org.tova.compiler.frontend.parser.ast.VariantPatternNode;
import org.tova.compiler.frontend.parser.ast.WildcardPatternNode;
import org.tova.compiler.frontend.types.AdtType;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.frontend.types.TypeCompatibility;
import org.tova.compiler.frontend.types.TypeRegistry;
import org.tova.compiler.internal.i18n.Messages;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that a {@code match} over an ADT covers every variant and that no arm follows a catch-all.
 */
public class ExhaustivenessChecker {

    private final TypeRegistry types;

    /**
     * @param types The declared types, including Result and Option.
     */
    public ExhaustivenessChecker(TypeRegistry types) {
        this.types = types;
    }

    /**
     * Reports one W200 warning per missing variant and one W207 warning per arm after a catch-all.
     * @param match The match expression.
     * @param subjectType The inferred type of the subject, possibly Unknown.
     * @param diagnostics Receives the warnings.
     */
    public void check(MatchNode match, Type subjectType, DiagnosticsEngine diagnostics) {
        boolean catchAll = false;
        for (MatchArmNode arm : match.arms()) {
            if (catchAll) {
                diagnostics.reportWarning(Messages.get("match.unreachable"), arm.loc(), CompilerErrorCode.W207, null);
                continue;
            }
            if (isCatchAll(arm)) catchAll = true;
        }
        if (catchAll) return;

        Set<String> covered = new LinkedHashSet<>();
        Set<String> mentioned = new LinkedHashSet<>();
        for (MatchArmNode arm : match.arms()) {
            if (arm.pattern() instanceof VariantPatternNode variant) {
                mentioned.add(variant.name());
                if (arm.guard() == null) covered.add(variant.name());
            }
        }
        if (mentioned.isEmpty()) return;

        Optional<AdtType> adt = resolve(subjectType, mentioned);
        if (adt.isEmpty()) return;
        for (String variant : adt.get().variants().keySet()) {
            if (!covered.contains(variant)) {
                diagnostics.reportWarning(Messages.get("match.missing", variant, adt.get().name()), match.loc(),
                        CompilerErrorCode.W200, Messages.get("match.missing.hint", variant));
            }
        }
    }

    /**
     * @param arm A match arm.
     * @return {@code true} for an unguarded wildcard or binding arm.
     */
    public static boolean isCatchAll(MatchArmNode arm) {
        AstNode pattern = arm.pattern();
        return arm.guard() == null && (pattern instanceof WildcardPatternNode || pattern instanceof BindingPatternNode);
    }

    private Optional<AdtType> resolve(Type subjectType, Set<String> mentioned) {
        if (subjectType instanceof AdtType adt && mentioned.stream().allMatch(adt::hasVariant)) {
            return Optional.of(adt);
        }
        String name = TypeCompatibility.nominalName(subjectType);
        if (name != null) {
            Optional<AdtType> declared = types.getAdt(name);
            if (declared.isPresent() && mentioned.stream().allMatch(declared.get()::hasVariant)) return declared;
        }
        List<AdtType> candidates = types.adts().stream()
                .filter(adt -> mentioned.stream().allMatch(adt::hasVariant))
                .toList();
        return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }
}
