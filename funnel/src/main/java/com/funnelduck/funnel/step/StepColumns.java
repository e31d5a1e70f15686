package com.funnelduck.funnel.step;

import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.CaseWhenExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.Literal;
import com.funnelduck.types.IntegerType;
import com.funnelduck.types.StringType;
import com.funnelduck.types.TimestampType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The per-event columns of one step (or exclusion pseudo-step).
 *
 * <pre>
 *   CASE WHEN &lt;predicate&gt; THEN 1 ELSE 0 END AS step_1
 *   CASE WHEN &lt;predicate&gt; THEN e."timestamp" ELSE NULL END AS latest_1
 * </pre>
 *
 * @param index the step index; for exclusions, the step the range starts at
 * @param prefix column prefix, empty for real steps
 * @param predicate whether the scanned event matches the step
 * @param recordingFields fields to carry per step, empty unless recordings are requested
 */
public record StepColumns(int index, String prefix, Expression predicate, List<RecordingField> recordingFields) {

    public StepColumns {
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        recordingFields = List.copyOf(Objects.requireNonNull(recordingFields, "recordingFields must not be null"));
    }

    public String flagName() {
        return prefix + FunnelColumns.step(index);
    }

    public String latestName() {
        return prefix + FunnelColumns.latest(index);
    }

    public ColumnReference flagRef() {
        return ColumnReference.of(flagName(), IntegerType.get());
    }

    public ColumnReference latestRef() {
        return ColumnReference.of(latestName(), TimestampType.get());
    }

    public Expression flagColumn() {
        return new AliasExpression(
            CaseWhenExpression.when(predicate, Literal.of(1), Literal.of(0)), flagName());
    }

    public Expression latestColumn() {
        return new AliasExpression(
            CaseWhenExpression.when(predicate, EventTable.timestamp(), Literal.nullValue(TimestampType.get())),
            latestName());
    }

    public List<Expression> recordingColumns() {
        List<Expression> columns = new ArrayList<>(recordingFields.size());
        for (RecordingField field : recordingFields) {
            columns.add(new AliasExpression(
                CaseWhenExpression.when(predicate, field.source(), Literal.nullValue(StringType.get())),
                prefix + FunnelColumns.recording(field, index)));
        }
        return columns;
    }

    /**
     * All columns this step contributes to the inner event query.
     */
    public List<Expression> projections() {
        List<Expression> columns = new ArrayList<>();
        columns.add(flagColumn());
        columns.add(latestColumn());
        columns.addAll(recordingColumns());
        return columns;
    }
}
