package io.mdpath.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.mdpath.core.visit.RawVisit;

/// Jackson mixin that binds `RawVisit` deserialization to its builder.
///
/// @apiNote The companion mixin {@link RawVisitBuilderMixin} maps the snake_case input
/// fields onto the builder methods.
///
/// @see io.mdpath.serialization.MdpathJacksonModule
@JsonDeserialize(builder = RawVisit.Builder.class)
public abstract class RawVisitMixin {}
