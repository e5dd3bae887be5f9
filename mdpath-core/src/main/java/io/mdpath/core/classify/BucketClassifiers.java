package io.mdpath.core.classify;

import io.mdpath.core.action.Action;
import io.mdpath.core.exception.UnrecognizedCategoryException;
import io.mdpath.core.state.SymptomStatus;
import io.mdpath.core.state.TumorSize;
import io.mdpath.core.stratification.AgeBucket;
import io.mdpath.core.stratification.Gender;
import io.mdpath.core.stratification.TumorGrade;
import io.mdpath.core.stratification.TumorLocation;
import io.mdpath.core.visit.RadiationType;
import io.mdpath.core.visit.RawVisit;
import io.mdpath.core.visit.SurgeryType;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/// Pure functions mapping raw clinical values onto closed label sets.
///
/// Every classifier is total over its well-typed inputs. The only one that fails is
/// {@link #gender(String)}, since an unknown gender cannot be placed in any graph.
///
/// Keyword classifiers are backed by {@link KeywordRules} whose declaration order is the
/// evaluation order:
/// Negated mentions ("not malignant", "no headache", "denies seizures or vision changes")
/// are ignored before the rules run, so they neither trigger their own label nor shadow a
/// later rule.
///
/// - **Grade**: grade 3 → grade 2 → grade 1
/// - **Location**: convexity → skull base → parasagittal → sphenoid wing
/// - **Symptoms**: asymptomatic phrases → symptomatic phrases
/// - **Surgery**: subtotal → gross total
/// - **Radiation**: fractionated → single session
///
/// @implNote Stateless and thread-safe.
public final class BucketClassifiers {

    public static final double AGE_LOWER_BOUNDARY = 50.0;
    public static final double AGE_UPPER_BOUNDARY = 65.0;
    public static final double SIZE_MEDIUM_CM = 3.0;
    public static final double SIZE_LARGE_CM = 5.0;
    public static final double OBSERVE_MEDIUM_MONTHS = 4.5;
    public static final double OBSERVE_LONG_MONTHS = 9.0;

    private static final String NEGATION = "(no|not|non|without|denies|denied|negative for)";

    private static final String SYMPTOM_TERM =
            "(symptomatic|headaches?|seizures?|weakness|hemiparesis|visual( changes| disturbances?)?"
                    + "|vision( changes| loss)?|diplopia|hearing loss|numbness|deficits?"
                    + "|cognitive( changes| decline)?|memory( loss| problems)?|dizziness|vertigo"
                    + "|ataxia|aphasia|confusion|pain)";

    static final KeywordRules<TumorGrade> GRADE_RULES =
            KeywordRules.<TumorGrade>builder()
                    .ignoring(
                            "\\b"
                                    + NEGATION
                                    + " (evidence of )?"
                                    + "(malignant|malignancy|anaplastic|anaplasia|atypical|atypia)\\b")
                    .pattern(TumorGrade.GRADE_3, "\\b(who )?grade (iii|3)\\b")
                    .pattern(TumorGrade.GRADE_3, "\\bwho (iii|3)\\b")
                    .phrases(TumorGrade.GRADE_3, "anaplastic", "malignant")
                    .pattern(TumorGrade.GRADE_2, "\\b(who )?grade (ii|2)\\b")
                    .pattern(TumorGrade.GRADE_2, "\\bwho (ii|2)\\b")
                    .phrases(TumorGrade.GRADE_2, "atypical")
                    .pattern(TumorGrade.GRADE_1, "\\b(who )?grade (i|1)\\b")
                    .pattern(TumorGrade.GRADE_1, "\\bwho (i|1)\\b")
                    .phrases(TumorGrade.GRADE_1, "benign", "typical")
                    .build();

    static final KeywordRules<TumorLocation> LOCATION_RULES =
            KeywordRules.<TumorLocation>builder()
                    .phrases(TumorLocation.CONVEXITY, "convexity", "convexital")
                    .phrases(
                            TumorLocation.SKULL_BASE,
                            "skull base",
                            "olfactory groove",
                            "planum sphenoidale",
                            "tuberculum sellae",
                            "petroclival",
                            "petrous",
                            "clival",
                            "clivus",
                            "cerebellopontine",
                            "cp angle",
                            "foramen magnum",
                            "cavernous sinus",
                            "anterior fossa",
                            "middle fossa",
                            "posterior fossa")
                    .phrases(
                            TumorLocation.PARASAGITTAL,
                            "parasagittal",
                            "falx",
                            "falcine",
                            "sagittal sinus")
                    .phrases(
                            TumorLocation.SPHENOID_WING,
                            "sphenoid wing",
                            "sphenoid",
                            "sphenoorbital",
                            "spheno orbital",
                            "clinoid")
                    .build();

    static final KeywordRules<SymptomStatus> SYMPTOM_RULES =
            KeywordRules.<SymptomStatus>builder()
                    .ignoring(
                            "\\b"
                                    + NEGATION
                                    + "( any| new| focal| recent)? "
                                    + SYMPTOM_TERM
                                    + "(( or| and| nor)?( any| new| focal| recent)? "
                                    + SYMPTOM_TERM
                                    + ")*\\b")
                    .phrases(
                            SymptomStatus.NONE,
                            "asymptomatic",
                            "no symptoms",
                            "no symptom",
                            "symptom free",
                            "incidental",
                            "incidentally",
                            "denies",
                            "no complaints",
                            "no new symptoms",
                            "no neurological deficit",
                            "no deficits",
                            "none")
                    .phrases(
                            SymptomStatus.PRESENT,
                            "symptomatic",
                            "headache",
                            "headaches",
                            "seizure",
                            "seizures",
                            "weakness",
                            "hemiparesis",
                            "visual",
                            "vision",
                            "diplopia",
                            "hearing loss",
                            "numbness",
                            "deficit",
                            "cognitive",
                            "memory",
                            "dizziness",
                            "vertigo",
                            "ataxia",
                            "aphasia",
                            "confusion",
                            "pain")
                    .build();

    static final KeywordRules<SurgeryType> SURGERY_RULES =
            KeywordRules.<SurgeryType>builder()
                    .phrases(SurgeryType.STR, "str", "subtotal", "sub total", "near total", "partial")
                    .pattern(SurgeryType.STR, "\\bsimpson (grade )?(iv|v|4|5)\\b")
                    .phrases(SurgeryType.GTR, "gtr", "gross total", "complete resection")
                    .pattern(SurgeryType.GTR, "\\bsimpson (grade )?(iii|ii|i|1|2|3)\\b")
                    .build();

    static final KeywordRules<RadiationType> RADIATION_RULES =
            KeywordRules.<RadiationType>builder()
                    .phrases(
                            RadiationType.FSRT,
                            "fsrt",
                            "fsr",
                            "fractionated",
                            "hypofractionated",
                            "imrt",
                            "proton")
                    .phrases(
                            RadiationType.SRS,
                            "srs",
                            "radiosurgery",
                            "gamma knife",
                            "cyberknife",
                            "single fraction")
                    .build();

    private static final Map<String, Gender> GENDER_SYNONYMS =
            Map.of(
                    "m", Gender.M,
                    "male", Gender.M,
                    "man", Gender.M,
                    "boy", Gender.M,
                    "f", Gender.F,
                    "female", Gender.F,
                    "woman", Gender.F,
                    "girl", Gender.F);

    private BucketClassifiers() {}

    /// Buckets age at diagnosis. Boundary values belong to the higher bucket.
    ///
    /// @param ageYears age in years
    /// @return age bucket, never null
    public static AgeBucket ageBucket(double ageYears) {
        if (ageYears < AGE_LOWER_BOUNDARY) {
            return AgeBucket.UNDER_50;
        }
        if (ageYears < AGE_UPPER_BOUNDARY) {
            return AgeBucket.FROM_50_TO_65;
        }
        return AgeBucket.AT_LEAST_65;
    }

    /// Maps gender text and its common synonyms onto `M`/`F`.
    ///
    /// @param text raw gender, may be null
    /// @return gender, never null
    /// @throws UnrecognizedCategoryException if the value is blank or not a known synonym
    public static Gender gender(String text) throws UnrecognizedCategoryException {
        Gender gender = GENDER_SYNONYMS.get(KeywordRules.normalize(text));
        if (gender == null) {
            throw new UnrecognizedCategoryException("gender", text);
        }
        return gender;
    }

    /// Classifies pathology text into a confirmed grade.
    ///
    /// @param pathologyText raw pathology text or grade label, may be null
    /// @return confirmed grade, empty if no pathology or no keyword matched
    public static Optional<TumorGrade> grade(String pathologyText) {
        return GRADE_RULES.classify(pathologyText);
    }

    /// Classifies location text; first match wins.
    ///
    /// @param locationText raw location, may be null
    /// @return location, {@link TumorLocation#OTHER} when nothing matches
    public static TumorLocation location(String locationText) {
        return LOCATION_RULES.classify(locationText).orElse(TumorLocation.OTHER);
    }

    /// Buckets the largest diameter on half-open intervals at 3.0 and 5.0 cm.
    ///
    /// @param diameterCm diameter in centimetres
    /// @return size bucket, never null
    public static TumorSize tumorSize(double diameterCm) {
        if (diameterCm < SIZE_MEDIUM_CM) {
            return TumorSize.SMALL;
        }
        if (diameterCm < SIZE_LARGE_CM) {
            return TumorSize.MEDIUM;
        }
        return TumorSize.LARGE;
    }

    /// Converts a spherical volume to its equivalent diameter: `d = (6V/π)^(1/3)`.
    ///
    /// @param volumeCm3 volume in cm³
    /// @return diameter in cm
    public static double diameterFromVolume(double volumeCm3) {
        return Math.cbrt(6.0 * volumeCm3 / Math.PI);
    }

    /// Resolves the diameter recorded at a visit.
    ///
    /// Priority: explicit diameter, then the largest per-axis dimension, then the
    /// volume-equivalent diameter.
    ///
    /// @param visit raw visit, not null
    /// @return diameter in cm, empty if the visit has no measurement
    public static OptionalDouble resolveDiameter(RawVisit visit) {
        if (visit.getTumorSizeCm() != null) {
            return OptionalDouble.of(visit.getTumorSizeCm());
        }
        if (!visit.getTumorDimensionsCm().isEmpty()) {
            return visit.getTumorDimensionsCm().stream().mapToDouble(Double::doubleValue).max();
        }
        if (visit.getTumorVolumeCm3() != null) {
            return OptionalDouble.of(diameterFromVolume(visit.getTumorVolumeCm3()));
        }
        return OptionalDouble.empty();
    }

    /// Classifies symptom text; asymptomatic phrases short-circuit to `NONE`.
    ///
    /// @param symptomsText raw text, may be null
    /// @return symptom status, `NONE` when nothing matches
    public static SymptomStatus symptoms(String symptomsText) {
        return SYMPTOM_RULES.classify(symptomsText).orElse(SymptomStatus.NONE);
    }

    /// Classifies the extent of resection.
    ///
    /// @param surgeryText raw surgery type or Simpson grade, may be null
    /// @return surgery type, `GTR` when unspecified
    public static SurgeryType surgeryType(String surgeryText) {
        return SURGERY_RULES.classify(surgeryText).orElse(SurgeryType.GTR);
    }

    /// Classifies the radiation modality.
    ///
    /// @param radiationText raw radiation type, may be null
    /// @return radiation type, `SRS` when unspecified
    public static RadiationType radiationType(String radiationText) {
        return RADIATION_RULES.classify(radiationText).orElse(RadiationType.SRS);
    }

    /// Infers the observation action from the literal gap between two visits.
    ///
    /// @param intervalMonths gap in months
    /// @return one of the three observation actions, never null
    public static Action observationAction(double intervalMonths) {
        if (intervalMonths < OBSERVE_MEDIUM_MONTHS) {
            return Action.OBSERVE_SHORT;
        }
        if (intervalMonths < OBSERVE_LONG_MONTHS) {
            return Action.OBSERVE_MEDIUM;
        }
        return Action.OBSERVE_LONG;
    }
}
