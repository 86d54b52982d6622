package com.entity.blocking.predicate;

import com.entity.blocking.core.model.Instance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Conjunction of member predicates. A record gets one key per combination of its
 * members' keys; if any member yields nothing the compound yields nothing.
 *
 * <p>A single-member compound passes its member's keys through unchanged. With several
 * members, backslashes and colons inside member keys are escaped before the keys are
 * joined with {@code ':'}, so distinct combinations never render to the same key.</p>
 */
public final class CompoundPredicate implements BlockingPredicate {

    private final List<BlockingPredicate> members;

    public CompoundPredicate(List<? extends BlockingPredicate> members) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("A compound predicate needs at least one member");
        }
        this.members = List.copyOf(members);
    }

    public static CompoundPredicate of(BlockingPredicate... members) {
        return new CompoundPredicate(Arrays.asList(members));
    }

    @Override
    public Set<String> apply(Instance instance, boolean target) {
        if (members.size() == 1) {
            return members.get(0).apply(instance, target);
        }
        List<String> combined = List.of("");
        for (int i = 0; i < members.size(); i++) {
            Set<String> keys = members.get(i).apply(instance, target);
            if (keys.isEmpty()) {
                return Set.of();
            }
            List<String> next = new ArrayList<>(combined.size() * keys.size());
            for (String prefix : combined) {
                for (String key : keys) {
                    next.add(i == 0 ? escape(key) : prefix + ':' + escape(key));
                }
            }
            combined = next;
        }
        return new LinkedHashSet<>(combined);
    }

    @Override
    public boolean requiresIndex() {
        return members.stream().anyMatch(BlockingPredicate::requiresIndex);
    }

    public List<BlockingPredicate> getMembers() {
        return members;
    }

    @Override
    public String describe() {
        if (members.size() == 1) {
            return members.get(0).describe();
        }
        return members.stream()
                .map(BlockingPredicate::describe)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return describe();
    }

    static String escape(String key) {
        return key.replace("\\", "\\\\").replace(":", "\\:");
    }
}
