package io.mdpath.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.mdpath.core.visit.PatientRecord;

/// Jackson mixin that binds `PatientRecord` deserialization to its builder.
///
/// @see PatientRecordBuilderMixin
/// @see io.mdpath.serialization.MdpathJacksonModule
@JsonDeserialize(builder = PatientRecord.Builder.class)
public abstract class PatientRecordMixin {}
