package io.conclave.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.conclave.core.execution.result.EvaluationHistory;
import io.conclave.core.metric.Scorecard;
import io.conclave.core.state.DiscussionSnapshot;
import io.conclave.core.worker.WorkerResult;
import io.conclave.serialization.mixin.DiscussionSnapshotMixin;
import io.conclave.serialization.mixin.EvaluationHistoryMixin;
import io.conclave.serialization.mixin.WorkerResultBuilderMixin;
import io.conclave.serialization.mixin.WorkerResultMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Conclave serialization configuration in one
/// place.
///
/// **Custom serializer/deserializer pairs**:
/// - `Scorecard`: `ScorecardSerializer` / `ScorecardDeserializer`, keeping explicit nulls
///   and metric order
///
/// **Mixins**:
/// - `WorkerResult` + `WorkerResult.Builder` (builder-based deserialization)
/// - `EvaluationHistory` (field visibility, no builder)
/// - `DiscussionSnapshot` (suppresses the derived `completed` flag)
///
/// Records (`RoundRecord`, `DiffContext`, `ConvergenceResult`, ...) need no registration.
///
/// @see DiscussionSerializer for the convenience factory API
public class ConclaveJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5921462710398176034L;

    public ConclaveJacksonModule() {
        super("ConclaveJacksonModule");

        addSerializer(Scorecard.class, new ScorecardSerializer());
        addDeserializer(Scorecard.class, new ScorecardDeserializer());
    }

    /// Applies mixin annotations to domain types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(WorkerResult.class, WorkerResultMixin.class);
        context.setMixInAnnotations(WorkerResult.Builder.class, WorkerResultBuilderMixin.class);

        context.setMixInAnnotations(EvaluationHistory.class, EvaluationHistoryMixin.class);
        context.setMixInAnnotations(DiscussionSnapshot.class, DiscussionSnapshotMixin.class);
    }
}
