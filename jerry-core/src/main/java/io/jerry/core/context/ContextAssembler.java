package io.jerry.core.context;

import io.jerry.core.model.ChatMessage;
import io.jerry.core.model.ToolCall;
import io.jerry.core.session.Turn;
import io.jerry.core.session.TurnRole;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Builds the bounded message list for one decision step. The system instruction, the latest
 * user turn and the latest round of tool calls with their results are always present; results
 * of that round are shortened when they overflow the token budget. Older history is taken
 * newest first in whole call-and-result groups and the rest is replaced by a one-line note.
 */
public final class ContextAssembler {
    static final int MIN_RESULT_CHARS = 200;
    private static final int CHARS_PER_TOKEN = 4;
    private static final int MARKER_RESERVE_CHARS = 64;

    private final ContextBudget budget;

    public ContextAssembler(ContextBudget budget) {
        this.budget = budget;
    }

    public ContextBudget budget() {
        return budget;
    }

    public AssembledContext assemble(List<Turn> turns, String systemPrompt) {
        ChatMessage system = ChatMessage.system(systemPrompt);
        List<Group> groups = group(turns);
        int lastUser = lastUserIndex(turns);

        int tokensLeft = budget.maxTokens() - system.estimatedTokens();
        int turnsLeft = budget.maxTurns();
        if (lastUser >= 0) {
            tokensLeft -= cost(turns.get(lastUser));
            turnsLeft--;
        }

        Group latestRound = null;
        List<Turn> roundTurns = List.of();
        int historyEnd = groups.size();
        Group last = groups.isEmpty() ? null : groups.get(groups.size() - 1);
        if (last != null && last.isRound(turns) && last.from() > lastUser) {
            latestRound = last;
            historyEnd--;
            Turn invocation = turns.get(last.from());
            tokensLeft -= cost(invocation);
            List<Turn> results = fitResults(turns.subList(last.from() + 1, last.to()), tokensLeft);
            roundTurns = new ArrayList<>(results.size() + 1);
            roundTurns.add(invocation);
            roundTurns.addAll(results);
            tokensLeft -= results.stream().mapToInt(ContextAssembler::cost).sum();
            turnsLeft -= roundTurns.size();
        }

        int start = latestRound == null ? turns.size() : latestRound.from();
        for (int g = historyEnd - 1; g >= 0; g--) {
            Group candidate = groups.get(g);
            if (candidate.from() == lastUser) {
                start = candidate.from();
                continue;
            }
            int groupCost = 0;
            for (int i = candidate.from(); i < candidate.to(); i++) {
                groupCost += cost(turns.get(i));
            }
            if (candidate.size() > turnsLeft || groupCost > tokensLeft) {
                break;
            }
            tokensLeft -= groupCost;
            turnsLeft -= candidate.size();
            start = candidate.from();
        }

        List<Turn> window = new ArrayList<>();
        if (lastUser >= 0 && lastUser < start) {
            window.add(turns.get(lastUser));
        }
        int historyTo = latestRound == null ? turns.size() : latestRound.from();
        window.addAll(turns.subList(Math.min(start, historyTo), historyTo));
        window.addAll(roundTurns);
        window = dropOrphanResults(window);

        int omitted = turns.size() - window.size();
        List<ChatMessage> messages = new ArrayList<>(window.size() + 2);
        messages.add(system);
        if (omitted > 0) {
            messages.add(ChatMessage.system(omittedNote(omitted)));
        }
        for (Turn turn : window) {
            messages.add(toMessage(turn));
        }
        return new AssembledContext(messages, window.size(), omitted);
    }

    static ChatMessage toMessage(Turn turn) {
        return switch (turn.role()) {
            case USER -> ChatMessage.user(turn.content());
            case AGENT -> turn.toolCalls().isEmpty()
                ? ChatMessage.assistant(turn.content())
                : ChatMessage.assistantWithToolCalls(turn.content(), turn.toolCalls());
            case TOOL, PEER -> ChatMessage.tool(turn.content(), turn.correlationId());
        };
    }

    // Smaller results keep their full text; the rest split what remains evenly.
    private static List<Turn> fitResults(List<Turn> results, int tokens) {
        int total = results.stream().mapToInt(ContextAssembler::cost).sum();
        if (total <= tokens) {
            return results;
        }
        int[] order = IntStream.range(0, results.size())
            .boxed()
            .sorted(Comparator.<Integer>comparingInt(i -> results.get(i).content().length()).thenComparingInt(i -> i))
            .mapToInt(Integer::intValue)
            .toArray();
        int remaining = Math.max(tokens, 0);
        int[] allowance = new int[results.size()];
        for (int k = 0; k < order.length; k++) {
            int index = order[k];
            int share = remaining / (order.length - k);
            allowance[index] = Math.min(cost(results.get(index)), share);
            remaining -= allowance[index];
        }
        List<Turn> fitted = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            Turn result = results.get(i);
            fitted.add(allowance[i] >= cost(result) ? result : shorten(result, allowance[i]));
        }
        return fitted;
    }

    private static Turn shorten(Turn result, int tokens) {
        String content = result.content();
        int keep = Math.max(MIN_RESULT_CHARS, tokens * CHARS_PER_TOKEN - MARKER_RESERVE_CHARS);
        if (keep >= content.length()) {
            return result;
        }
        String shortened = content.substring(0, keep)
            + "\n[truncated " + (content.length() - keep) + " characters to fit the context window]";
        return new Turn(result.role(), shortened, result.timestamp(), result.correlationId(), result.toolCalls());
    }

    // A result whose originating call fell out of the window would be rejected by the model API.
    private static List<Turn> dropOrphanResults(List<Turn> window) {
        Set<String> issued = new HashSet<>();
        List<Turn> kept = new ArrayList<>(window.size());
        for (Turn turn : window) {
            if (turn.role() == TurnRole.AGENT) {
                for (ToolCall call : turn.toolCalls()) {
                    issued.add(call.id());
                }
            }
            if (turn.isResult() && turn.correlationId() != null && !issued.contains(turn.correlationId())) {
                continue;
            }
            kept.add(turn);
        }
        return kept;
    }

    private static List<Group> group(List<Turn> turns) {
        List<Group> groups = new ArrayList<>();
        int i = 0;
        while (i < turns.size()) {
            Turn turn = turns.get(i);
            int end = i + 1;
            if (turn.role() == TurnRole.AGENT && !turn.toolCalls().isEmpty()) {
                Set<String> ids = new HashSet<>();
                turn.toolCalls().forEach(call -> ids.add(call.id()));
                while (end < turns.size() && turns.get(end).isResult() && ids.contains(turns.get(end).correlationId())) {
                    end++;
                }
            }
            groups.add(new Group(i, end));
            i = end;
        }
        return groups;
    }

    private static int cost(Turn turn) {
        return toMessage(turn).estimatedTokens();
    }

    private static int lastUserIndex(List<Turn> turns) {
        for (int i = turns.size() - 1; i >= 0; i--) {
            if (turns.get(i).role() == TurnRole.USER) {
                return i;
            }
        }
        return -1;
    }

    private static String omittedNote(int omitted) {
        return "Earlier conversation history (" + omitted + (omitted == 1 ? " turn" : " turns")
            + ") was omitted to fit the context window.";
    }

    private record Group(int from, int to) {
        int size() {
            return to - from;
        }

        boolean isRound(List<Turn> turns) {
            Turn head = turns.get(from);
            return head.role() == TurnRole.AGENT && !head.toolCalls().isEmpty();
        }
    }
}
