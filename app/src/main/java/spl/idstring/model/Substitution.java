package spl.idstring.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Substitution points created by one polymer attachment event. Points are kept sorted; groups compare
 * lexicographically over their points.
 */
public final class Substitution implements Comparable<Substitution> {

    private final List<SubstitutionPoint> points;

    public Substitution(List<SubstitutionPoint> points) {
        Objects.requireNonNull(points, "points");
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Substitution requires at least one point");
        }
        this.points = points.stream().sorted().collect(Collectors.toUnmodifiableList());
    }

    public List<SubstitutionPoint> points() {
        return points;
    }

    void assignName(String name) {
        points.forEach(point -> point.assignName(name));
    }

    @Override
    public int compareTo(Substitution other) {
        int shared = Math.min(points.size(), other.points.size());
        for (int i = 0; i < shared; i++) {
            int result = points.get(i).compareTo(other.points.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(points.size(), other.points.size());
    }
}
