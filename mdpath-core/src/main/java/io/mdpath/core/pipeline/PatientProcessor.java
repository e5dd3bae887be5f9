package io.mdpath.core.pipeline;

import io.mdpath.core.MdpathConfig;
import io.mdpath.core.classify.BucketClassifiers;
import io.mdpath.core.exception.MissingFieldException;
import io.mdpath.core.exception.PatientProcessingException;
import io.mdpath.core.imputation.ImputationEngine;
import io.mdpath.core.imputation.ImputationResult;
import io.mdpath.core.imputation.ImputedVisit;
import io.mdpath.core.phase.TreatmentPhaseMachine;
import io.mdpath.core.state.TreatmentPhase;
import io.mdpath.core.stratification.StratificationKey;
import io.mdpath.core.stratification.TumorGrade;
import io.mdpath.core.transition.PatientTimeline;
import io.mdpath.core.transition.TransitionBuilder;
import io.mdpath.core.validation.TimelineValidator;
import io.mdpath.core.validation.ValidationWarning;
import io.mdpath.core.visit.PatientRecord;
import io.mdpath.core.visit.RawVisit;
import io.mdpath.core.visit.Visit;
import io.mdpath.core.visit.VisitTimeResolver;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs the per-patient stages: time resolution → demographics → imputation → phase derivation →
/// state/action assembly → transition building → validation.
///
/// Fatal conditions are caught here and turned into a {@link PatientError}; a timeline
/// truncated by an invalid interval keeps the visits before it.
///
/// @implNote Stateless and thread-safe; patients are processed independently.
public final class PatientProcessor {

    private static final Logger logger = Logger.getLogger(PatientProcessor.class.getName());

    private static final Comparator<RawVisit> CHRONOLOGICAL =
            Comparator.comparingDouble(RawVisit::getMonthsSinceDiagnosis);

    private final MdpathConfig config;
    private final ImputationEngine imputationEngine;
    private final TreatmentPhaseMachine phaseMachine;
    private final TransitionBuilder transitionBuilder;
    private final TimelineValidator validator;

    public PatientProcessor(
            MdpathConfig config,
            ImputationEngine imputationEngine,
            TreatmentPhaseMachine phaseMachine,
            TransitionBuilder transitionBuilder,
            TimelineValidator validator) {
        this.config = Objects.requireNonNull(config, "config");
        this.imputationEngine = Objects.requireNonNull(imputationEngine, "imputationEngine");
        this.phaseMachine = Objects.requireNonNull(phaseMachine, "phaseMachine");
        this.transitionBuilder = Objects.requireNonNull(transitionBuilder, "transitionBuilder");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /// Processes one patient.
    ///
    /// @param input the input record, not null
    /// @return the outcome, never null; failures are reported in the outcome, not thrown
    public PatientOutcome process(PatientRecord input) {
        String patientId = input.getPatientId();
        PatientTimeline empty = new PatientTimeline(patientId, List.of(), List.of(), List.of());

        PatientRecord record;
        StratificationKey baseKey;
        ImputationResult imputation;
        try {
            record = VisitTimeResolver.resolve(input);
            baseKey = baseKey(record);
            imputation = imputationEngine.impute(patientId, sortedVisits(record));
        } catch (PatientProcessingException e) {
            logger.warning("Patient " + patientId + " skipped: " + e.getMessage());
            return new PatientOutcome(patientId, empty, List.of(), PatientError.of(patientId, e, false));
        }

        List<ImputedVisit> imputed = imputation.visits();
        List<TreatmentPhase> phases = phaseMachine.derive(imputed);
        List<Visit> visits = new ArrayList<>(imputed.size());
        for (int i = 0; i < imputed.size(); i++) {
            visits.add(Visit.of(imputed.get(i), phases.get(i)));
        }

        PatientTimeline timeline = transitionBuilder.build(patientId, baseKey, visits);

        List<ValidationWarning> warnings = new ArrayList<>(imputation.warnings());
        warnings.addAll(validator.validate(record, timeline));

        PatientError error = null;
        if (imputation.isTruncated()) {
            PatientProcessingException failure = imputation.failure();
            logger.warning(
                    "Patient "
                            + patientId
                            + " truncated after "
                            + visits.size()
                            + " visits: "
                            + failure.getMessage());
            error = PatientError.of(patientId, failure, !visits.isEmpty());
        }

        logger.fine(
                "Patient "
                        + patientId
                        + ": "
                        + visits.size()
                        + " visits, "
                        + timeline.transitions().size()
                        + " transitions");
        return new PatientOutcome(patientId, timeline, warnings, error);
    }

    /// Builds the stratification key from static demographics and a provisional grade.
    ///
    /// The grade is replaced by the first visit's grade when the timeline is built.
    private static StratificationKey baseKey(PatientRecord record) throws PatientProcessingException {
        if (record.getAgeAtDiagnosis() == null) {
            throw new MissingFieldException("age_at_diagnosis", -1);
        }
        return new StratificationKey(
                BucketClassifiers.ageBucket(record.getAgeAtDiagnosis()),
                BucketClassifiers.gender(record.getGender()),
                TumorGrade.GRADE_1,
                BucketClassifiers.location(record.getLocation()));
    }

    private List<RawVisit> sortedVisits(PatientRecord record) {
        List<RawVisit> visits = new ArrayList<>(record.getVisits());
        if (config.isSortVisits()) {
            visits.sort(CHRONOLOGICAL);
        }
        return visits;
    }
}
