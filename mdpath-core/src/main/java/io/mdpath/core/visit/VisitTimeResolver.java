package io.mdpath.core.visit;

import io.mdpath.core.exception.MissingFieldException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/// Puts every visit of a record on the months-since-diagnosis axis.
///
/// A visit keeps its `monthsSinceDiagnosis` when present. Otherwise its `visitDate` is
/// measured from the record's diagnosis date, or from the earliest visit date when the
/// diagnosis date is absent. A visit with neither field fails the patient.
public final class VisitTimeResolver {

    /// Mean Gregorian month.
    static final double DAYS_PER_MONTH = 365.2425 / 12.0;

    private VisitTimeResolver() {
        // Utility class - prevent instantiation
    }

    /// Resolves the visit times of one record.
    ///
    /// @param record the input record, not null
    /// @return the same record if nothing needed resolving, else a copy whose visits all
    ///     carry months since diagnosis
    /// @throws MissingFieldException if a visit has neither months nor a date
    public static PatientRecord resolve(PatientRecord record) throws MissingFieldException {
        List<RawVisit> visits = record.getVisits();
        boolean resolved = true;
        for (int i = 0; i < visits.size(); i++) {
            RawVisit visit = visits.get(i);
            if (!visit.hasTime()) {
                throw new MissingFieldException("months_since_diagnosis or visit_date", i);
            }
            resolved &= visit.getMonthsSinceDiagnosis() != null;
        }
        if (resolved) {
            return record;
        }

        LocalDate origin = origin(record);
        List<RawVisit> result = new ArrayList<>(visits.size());
        for (RawVisit visit : visits) {
            if (visit.getMonthsSinceDiagnosis() != null) {
                result.add(visit);
            } else {
                result.add(
                        visit.toBuilder()
                                .monthsSinceDiagnosis(monthsBetween(origin, visit.getVisitDate()))
                                .build());
            }
        }
        return record.toBuilder().visits(result).build();
    }

    static double monthsBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to) / DAYS_PER_MONTH;
    }

    private static LocalDate origin(PatientRecord record) {
        if (record.getDiagnosisDate() != null) {
            return record.getDiagnosisDate();
        }
        LocalDate earliest = null;
        for (RawVisit visit : record.getVisits()) {
            LocalDate date = visit.getVisitDate();
            if (date != null && (earliest == null || date.isBefore(earliest))) {
                earliest = date;
            }
        }
        return earliest;
    }
}
