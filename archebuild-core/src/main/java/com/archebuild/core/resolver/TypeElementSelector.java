package com.archebuild.core.resolver;

import com.archebuild.core.model.ElementCategory;
import com.archebuild.core.model.TypeElementRecord;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the type-element record effective for a construction year and technique.
 *
 * <p>Records are candidates when their key starts with the category prefix, their age
 * range contains the year (both bounds inclusive) and their construction type equals
 * the technique. If several candidates exist, the one with the narrowest age range
 * wins; among equally narrow ranges the lexicographically greatest key wins. The
 * result therefore does not depend on the order records are stored in.
 */
public final class TypeElementSelector {

    /** Orders candidates from most to least preferred. */
    static final Comparator<TypeElementRecord> PREFERENCE =
        Comparator.comparingInt((TypeElementRecord record) -> record.ageRange().span())
            .thenComparing(TypeElementRecord::key, Comparator.reverseOrder());

    private TypeElementSelector() {
        // Utility class
    }

    /**
     * Filters all records matching category, year and technique.
     *
     * @param records records to search, in storage order
     * @param category element category
     * @param year construction year
     * @param technique construction technique
     * @return matching records in storage order
     */
    public static List<TypeElementRecord> candidates(Collection<TypeElementRecord> records,
                                                     ElementCategory category, int year, String technique) {
        return records.stream()
            .filter(record -> record.matches(category, year, technique))
            .toList();
    }

    /**
     * Chooses the preferred record among candidates.
     *
     * @param candidates matching records
     * @return preferred record, or empty if there are no candidates
     */
    public static Optional<TypeElementRecord> select(Collection<TypeElementRecord> candidates) {
        return candidates.stream().min(PREFERENCE);
    }
}
