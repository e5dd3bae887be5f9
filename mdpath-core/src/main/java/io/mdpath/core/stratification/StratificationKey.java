package io.mdpath.core.stratification;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// Immutable identity of one MDP graph: (age bucket, gender, grade, location).
///
/// Keys are never mutated. A grade change mid-timeline is expressed by deriving a
/// replacement key with {@link #withGrade(TumorGrade)}; transitions built earlier keep the
/// key that was current when they were built.
///
/// Natural ordering follows the declaration order of the four enumerations, which gives
/// the canonical iteration order of the graph registry.
///
/// @param age age bucket at diagnosis, not null
/// @param gender patient gender, not null
/// @param grade tumor grade, not null
/// @param location tumor location, not null
public record StratificationKey(
        AgeBucket age, Gender gender, TumorGrade grade, TumorLocation location)
        implements Comparable<StratificationKey> {

    /// Number of keys in the full Cartesian product of the four enumerations.
    public static final int CARDINALITY =
            AgeBucket.values().length
                    * Gender.values().length
                    * TumorGrade.values().length
                    * TumorLocation.values().length;

    private static final Comparator<StratificationKey> ORDER =
            Comparator.comparing(StratificationKey::age)
                    .thenComparing(StratificationKey::gender)
                    .thenComparing(StratificationKey::grade)
                    .thenComparing(StratificationKey::location);

    public StratificationKey {
        Objects.requireNonNull(age, "age");
        Objects.requireNonNull(gender, "gender");
        Objects.requireNonNull(grade, "grade");
        Objects.requireNonNull(location, "location");
    }

    /// Returns a key identical to this one except for the grade.
    ///
    /// @param newGrade replacement grade, not null
    /// @return this key if the grade is unchanged, otherwise a new key, never null
    public StratificationKey withGrade(TumorGrade newGrade) {
        if (grade == newGrade) {
            return this;
        }
        return new StratificationKey(age, gender, newGrade, location);
    }

    /// Lists the stratification factors in which `other` differs from this key.
    ///
    /// @param other the key to compare with, not null
    /// @return factor names (`age`, `gender`, `tumor_grade`, `location`), empty if equal
    public List<String> changedFactors(StratificationKey other) {
        List<String> changed = new ArrayList<>();
        if (age != other.age) changed.add("age");
        if (gender != other.gender) changed.add("gender");
        if (grade != other.grade) changed.add("tumor_grade");
        if (location != other.location) changed.add("location");
        return List.copyOf(changed);
    }

    /// Enumerates all keys in canonical order.
    ///
    /// @return all 90 keys, never null
    public static List<StratificationKey> all() {
        List<StratificationKey> keys = new ArrayList<>(CARDINALITY);
        for (AgeBucket a : AgeBucket.values()) {
            for (Gender g : Gender.values()) {
                for (TumorGrade gr : TumorGrade.values()) {
                    for (TumorLocation l : TumorLocation.values()) {
                        keys.add(new StratificationKey(a, g, gr, l));
                    }
                }
            }
        }
        return List.copyOf(keys);
    }

    /// Returns the canonical identifier, e.g. `50-65|F|grade_1|convexity`.
    ///
    /// @return identifier string, never null
    public String id() {
        return age.label() + "|" + gender.label() + "|" + grade.label() + "|" + location.label();
    }

    @Override
    public int compareTo(StratificationKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return id();
    }
}
