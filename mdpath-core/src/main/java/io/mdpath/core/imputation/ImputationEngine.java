package io.mdpath.core.imputation;

import io.mdpath.core.MdpathConfig;
import io.mdpath.core.classify.BucketClassifiers;
import io.mdpath.core.classify.GrowthVelocityClassifier;
import io.mdpath.core.exception.InvalidIntervalException;
import io.mdpath.core.exception.MissingBaselineException;
import io.mdpath.core.state.GrowthVelocity;
import io.mdpath.core.state.SymptomStatus;
import io.mdpath.core.stratification.TumorGrade;
import io.mdpath.core.validation.ValidationWarning;
import io.mdpath.core.validation.WarningType;
import io.mdpath.core.visit.RawVisit;
import io.mdpath.core.visit.SurgeryType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.logging.Logger;

/// Fills gaps in one patient's chronologically sorted visit sequence.
///
/// Visits are processed left to right. Per field:
/// - **Tumor size**: the first visit must be measured. A surgery visit without a
///   measurement gets the previous size times the GTR or STR shrink factor; any other
///   unmeasured visit carries the previous size forward. The first measurement at or after a
///   surgery that exceeds the pre-surgery size is capped and reported.
/// - **Symptoms**: missing text carries the previous status; `NONE` on the first visit.
/// - **Grade**: the most recent confirmed pathology wins, including downgrades. Before any
///   confirmed pathology the grade is `GRADE_1`, flagged as assumed.
/// - **Growth velocity**: `STABLE` on the first visit, on a surgery visit and on the visit
///   right after a surgery. Intervals shorter than the configured minimum carry the previous
///   velocity forward with a warning; non-positive intervals truncate the timeline.
///
/// @implNote Stateless apart from immutable configuration; thread-safe.
public final class ImputationEngine {

    private static final Logger logger = Logger.getLogger(ImputationEngine.class.getName());

    private final MdpathConfig config;
    private final GrowthVelocityClassifier velocityClassifier;

    public ImputationEngine(MdpathConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.velocityClassifier = GrowthVelocityClassifier.from(config);
    }

    /// Imputes missing fields for a sorted visit sequence.
    ///
    /// @param patientId patient identifier used in warnings, not null
    /// @param visits visits in chronological order with resolved months, not null
    /// @return imputed visits with warnings, possibly truncated, never null
    /// @throws MissingBaselineException if the first visit has no size measurement
    public ImputationResult impute(String patientId, List<RawVisit> visits)
            throws MissingBaselineException {
        Objects.requireNonNull(patientId, "patientId");
        List<ImputedVisit> imputed = new ArrayList<>(visits.size());
        List<ValidationWarning> warnings = new ArrayList<>();

        if (visits.isEmpty()) {
            return new ImputationResult(imputed, warnings, null);
        }
        if (!visits.get(0).hasMeasurement()) {
            throw new MissingBaselineException(
                    "Patient " + patientId + " has no tumor measurement on the first visit");
        }

        TumorGrade lastConfirmedGrade = null;
        Double preSurgerySize = null;
        boolean awaitingPostSurgeryMeasurement = false;

        for (int i = 0; i < visits.size(); i++) {
            RawVisit raw = visits.get(i);
            ImputedVisit previous = i > 0 ? imputed.get(i - 1) : null;
            boolean surgeryHere = raw.isSurgeryPerformed();

            if (surgeryHere && previous != null) {
                preSurgerySize = previous.sizeCm();
                awaitingPostSurgeryMeasurement = true;
            }

            // Size
            OptionalDouble measured = BucketClassifiers.resolveDiameter(raw);
            double sizeCm;
            boolean sizeImputed;
            if (measured.isPresent()) {
                sizeCm = measured.getAsDouble();
                sizeImputed = false;
                if (awaitingPostSurgeryMeasurement) {
                    awaitingPostSurgeryMeasurement = false;
                    if (sizeCm > preSurgerySize) {
                        double capped = preSurgerySize * config.getPostSurgeryCapFactor();
                        warnings.add(
                                new ValidationWarning(
                                        patientId,
                                        WarningType.CONTRADICTORY_POST_SURGERY_SIZE,
                                        i,
                                        "Post-surgery size "
                                                + sizeCm
                                                + " cm exceeds pre-surgery size "
                                                + preSurgerySize
                                                + " cm; capped at "
                                                + capped
                                                + " cm"));
                        sizeCm = capped;
                    }
                }
            } else if (surgeryHere) {
                SurgeryType type = BucketClassifiers.surgeryType(raw.getSurgeryType());
                double factor =
                        type == SurgeryType.STR
                                ? config.getStrShrinkFactor()
                                : config.getGtrShrinkFactor();
                sizeCm = previous.sizeCm() * factor;
                sizeImputed = true;
            } else {
                sizeCm = previous.sizeCm();
                sizeImputed = true;
            }

            // Symptoms
            SymptomStatus symptoms;
            if (raw.getSymptomsText() == null || raw.getSymptomsText().isBlank()) {
                symptoms = previous != null ? previous.symptoms() : SymptomStatus.NONE;
            } else {
                symptoms = BucketClassifiers.symptoms(raw.getSymptomsText());
            }

            // Grade
            Optional<TumorGrade> confirmed = BucketClassifiers.grade(raw.getGradeFromPathology());
            if (confirmed.isPresent()) {
                lastConfirmedGrade = confirmed.get();
            }
            TumorGrade grade = lastConfirmedGrade != null ? lastConfirmedGrade : TumorGrade.GRADE_1;
            boolean gradeAssumed = lastConfirmedGrade == null;

            // Growth velocity
            GrowthVelocity velocity;
            if (previous == null || surgeryHere || previous.raw().isSurgeryPerformed()) {
                velocity = GrowthVelocity.STABLE;
            } else {
                double interval = raw.getMonthsSinceDiagnosis() - previous.months();
                if (interval <= 0) {
                    InvalidIntervalException failure = new InvalidIntervalException(i, interval);
                    logger.fine(
                            "Truncating timeline of "
                                    + patientId
                                    + " at visit "
                                    + i
                                    + ": "
                                    + failure.getMessage());
                    return new ImputationResult(imputed, warnings, failure);
                }
                if (interval < config.getMinVelocityIntervalMonths()) {
                    velocity = previous.velocity();
                    warnings.add(
                            new ValidationWarning(
                                    patientId,
                                    WarningType.SHORT_VELOCITY_INTERVAL,
                                    i,
                                    "Interval of "
                                            + interval
                                            + " months is too short for growth velocity; carried "
                                            + velocity.label()
                                            + " forward"));
                } else {
                    velocity = velocityClassifier.classify(previous.sizeCm(), sizeCm, interval);
                }
            }

            imputed.add(
                    new ImputedVisit(
                            i,
                            raw,
                            sizeCm,
                            sizeImputed,
                            BucketClassifiers.tumorSize(sizeCm),
                            symptoms,
                            velocity,
                            grade,
                            gradeAssumed));
        }

        return new ImputationResult(imputed, warnings, null);
    }
}
