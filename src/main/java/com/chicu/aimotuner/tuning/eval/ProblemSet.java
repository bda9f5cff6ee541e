package com.chicu.aimotuner.tuning.eval;

import java.util.Iterator;
import java.util.List;

/**
 * Упорядоченный непустой набор задач. Порядок стабилен весь запуск:
 * от него зависит траектория промежуточной точности для pruner'а.
 */
public final class ProblemSet implements Iterable<Problem> {

    private final List<Problem> problems;

    private ProblemSet(List<Problem> problems) {
        this.problems = problems;
    }

    public static ProblemSet of(List<Problem> problems) {
        if (problems == null || problems.isEmpty()) {
            throw new IllegalArgumentException("ProblemSet: пустой набор задач");
        }
        return new ProblemSet(List.copyOf(problems));
    }

    public static ProblemSet of(Problem... problems) {
        return of(List.of(problems));
    }

    public int size() {
        return problems.size();
    }

    public Problem get(int index) {
        return problems.get(index);
    }

    @Override
    public Iterator<Problem> iterator() {
        return problems.iterator();
    }
}
