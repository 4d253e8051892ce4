package com.moonshift.pass;

import com.moonshift.ast.*;
import com.moonshift.pipeline.Warning;
import com.moonshift.scope.Symbol;
import com.moonshift.value.LuaValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repairs script-breaking patterns and reports every change as a {@link Warning.Category#REPAIR}
 * warning. Repairs that need the token stream (a missing {@code end}, a {@code return} that
 * is not last) happen in the parser when it runs in repair mode; this pass handles the ones
 * visible in the tree:
 * <ul>
 *   <li>locals named after contextual keywords ({@code continue}, {@code type}, ...)</li>
 *   <li>misspelled service names in {@code GetService("...")}</li>
 *   <li>{@code RunService.Heartbeat(fn)} instead of {@code RunService.Heartbeat:Connect(fn)}</li>
 * </ul>
 */
public class StructuralFixer implements Pass {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralFixer.class);

    public static final String NAME = "structural-fixer";

    private static final Set<String> CONTEXTUAL_KEYWORDS = Set.of("continue", "goto", "export", "type", "typeof");

    private static final Set<String> RUN_SERVICE_EVENTS = Set.of("RenderStepped", "Heartbeat", "Stepped");

    static final List<String> SERVICES = List.of(
        "Players", "Workspace", "ReplicatedStorage", "ReplicatedFirst", "ServerStorage", "ServerScriptService",
        "StarterGui", "StarterPack", "StarterPlayer", "Lighting", "RunService", "UserInputService",
        "TweenService", "HttpService", "SoundService", "Teams", "Chat", "TextService", "TextChatService",
        "MarketplaceService", "DataStoreService", "CollectionService", "Debris", "PathfindingService",
        "ContextActionService", "GuiService", "TeleportService", "BadgeService", "PhysicsService",
        "ContentProvider", "LocalizationService", "GroupService", "InsertService", "MessagingService",
        "PolicyService", "ProximityPromptService", "SocialService", "VRService", "HapticService", "CoreGui");

    static final int MAX_TYPO_DISTANCE = 2;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Chunk apply(Chunk chunk, PassContext context) {
        Chunk renamed = renameKeywordLocals(chunk, context);
        Chunk fixed = new Fixer(context).rewrite(renamed);
        LOG.debug("Structural fixes applied");
        return fixed;
    }

    private static Chunk renameKeywordLocals(Chunk chunk, PassContext context) {
        Set<String> taken = IdentifierRenamer.usedNames(chunk);
        Map<Symbol, String> names = new HashMap<>();
        new AstWalker() {
            @Override
            protected void declare(Identifier identifier) {
                Symbol symbol = identifier.symbol();
                if (CONTEXTUAL_KEYWORDS.contains(identifier.name()) && !names.containsKey(symbol)) {
                    String replacement = identifier.name() + "_";
                    while (taken.contains(replacement)) {
                        replacement += "_";
                    }
                    taken.add(replacement);
                    names.put(symbol, replacement);
                    context.warn(NAME, Warning.Category.REPAIR,
                        "renamed local '" + identifier.name() + "' to '" + replacement + "'", identifier.loc());
                }
            }
        }.walk(chunk);
        return names.isEmpty() ? chunk : new IdentifierRenamer.Renamer(NAME, context, names).rewrite(chunk);
    }

    private static final class Fixer extends AstRewriter {

        Fixer(PassContext context) {
            super(NAME, context);
        }

        @Override
        protected Expression transformExpression(Expression expression) {
            if (expression instanceof MethodCallExpression call && "GetService".equals(call.method())
                && call.arguments().size() == 1 && call.arguments().get(0) instanceof Literal literal
                && literal.value() instanceof LuaValue.Str service) {
                String corrected = correctService(service.bytes());
                if (corrected != null) {
                    context.warn(NAME, Warning.Category.REPAIR,
                        "service '" + service.bytes() + "' corrected to '" + corrected + "'", literal.loc());
                    return new MethodCallExpression(call.loc(), call.object(), call.method(),
                        List.of(new Literal(literal.loc(), LuaValue.ofBytes(corrected), null)));
                }
            }
            if (expression instanceof CallExpression call && call.callee() instanceof IndexExpression event
                && event.dotted() && RUN_SERVICE_EVENTS.contains(event.fieldName()) && call.arguments().size() == 1) {
                context.warn(NAME, Warning.Category.REPAIR,
                    event.fieldName() + " called directly; connected instead", call.loc());
                return new MethodCallExpression(call.loc(), event, "Connect", call.arguments());
            }
            return expression;
        }
    }

    /**
     * @return the closest known service within {@link #MAX_TYPO_DISTANCE}, or null when the name
     *         is already known or nothing is close enough
     */
    static String correctService(String name) {
        if (SERVICES.contains(name)) {
            return null;
        }
        String best = null;
        int bestDistance = MAX_TYPO_DISTANCE + 1;
        for (String service : SERVICES) {
            int distance = levenshtein(name, service);
            if (distance < bestDistance) {
                best = service;
                bestDistance = distance;
            }
        }
        return best;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j], current[j - 1]) + 1);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
