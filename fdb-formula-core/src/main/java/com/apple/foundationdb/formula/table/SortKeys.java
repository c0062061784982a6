/*
 * SortKeys.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2026 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apple.foundationdb.formula.table;

import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.datetime.DateTimeNormalizer;
import com.apple.foundationdb.formula.values.BooleanValue;
import com.apple.foundationdb.formula.values.DecimalValue;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.NumberValue;
import com.apple.foundationdb.formula.values.StringValue;
import com.apple.foundationdb.formula.values.TableRow;
import com.apple.foundationdb.formula.values.TimeValue;
import com.apple.foundationdb.formula.values.ValueKind;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.tuple.Pair;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.text.Collator;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sort keys for {@code Sort} and {@code SortByColumns}. All keys in one position must share a kind; blanks
 * sort last whichever the direction. Sorting is stable.
 */
@API(API.Status.INTERNAL)
public final class SortKeys {
    private static final Set<ValueKind> SORTABLE_KINDS = ImmutableSet.of(ValueKind.NUMBER, ValueKind.DECIMAL,
            ValueKind.STRING, ValueKind.BOOLEAN, ValueKind.DATE, ValueKind.DATE_TIME, ValueKind.TIME);

    private SortKeys() {
        // private constructor - static methods only in this class. No instances.
    }

    public static boolean isSortable(@Nonnull ValueKind kind) {
        return SORTABLE_KINDS.contains(kind);
    }

    /**
     * Find the single kind shared by a list of keys, ignoring blanks.
     * @param keys the keys of one sort position, with no errors among them
     * @return the kind, {@link ValueKind#BLANK} if every key is blank, or {@code null} if the kinds are mixed or
     * not sortable
     */
    @Nullable
    public static ValueKind commonKind(@Nonnull List<FormulaValue> keys) {
        ValueKind kind = ValueKind.BLANK;
        for (FormulaValue key : keys) {
            if (key.getKind() == ValueKind.BLANK) {
                continue;
            }
            if (!isSortable(key.getKind())) {
                return null;
            }
            if (kind == ValueKind.BLANK) {
                kind = key.getKind();
            } else if (kind != key.getKind()) {
                return null;
            }
        }
        return kind;
    }

    /**
     * Comparator for keys of one kind. Blanks compare after every other key in both directions.
     * @param kind the kind of the non-blank keys
     * @param ascending the direction
     * @param context the evaluation context, whose locale orders strings and whose zone orders date-times
     * @return the comparator
     */
    @Nonnull
    public static Comparator<FormulaValue> comparator(@Nonnull ValueKind kind, boolean ascending,
                                                      @Nonnull EvaluationContext context) {
        final Comparator<FormulaValue> values = ascending ? valueComparator(kind, context) : valueComparator(kind, context).reversed();
        return (left, right) -> {
            if (left.isBlank()) {
                return right.isBlank() ? 0 : 1;
            } else if (right.isBlank()) {
                return -1;
            }
            return values.compare(left, right);
        };
    }

    /**
     * Stably sort rows by their keys. Keys are applied in order, each with its own direction, falling through to
     * the next key on ties.
     * @param rowsWithKeys each row with its key values, one per sort position
     * @param kinds the common kind of each sort position
     * @param ascending the direction of each sort position
     * @param context the evaluation context
     * @return the rows in sorted order
     */
    @Nonnull
    public static List<TableRow> sortRows(@Nonnull List<Pair<TableRow, List<FormulaValue>>> rowsWithKeys,
                                          @Nonnull List<ValueKind> kinds,
                                          @Nonnull List<Boolean> ascending,
                                          @Nonnull EvaluationContext context) {
        Comparator<Pair<TableRow, List<FormulaValue>>> order = (left, right) -> 0;
        for (int i = 0; i < kinds.size(); i++) {
            final int position = i;
            final Comparator<FormulaValue> keyOrder = comparator(kinds.get(i), ascending.get(i), context);
            order = order.thenComparing(pair -> pair.getRight().get(position), keyOrder);
        }
        final List<Pair<TableRow, List<FormulaValue>>> sorted = new ArrayList<>(rowsWithKeys);
        sorted.sort(order);
        return sorted.stream().map(Pair::getLeft).collect(Collectors.toList());
    }

    @Nonnull
    private static Comparator<FormulaValue> valueComparator(@Nonnull ValueKind kind, @Nonnull EvaluationContext context) {
        switch (kind) {
            case NUMBER:
                return Comparator.comparingDouble(value -> ((NumberValue)value).getValue());
            case DECIMAL:
                return Comparator.comparing(value -> ((DecimalValue)value).getValue());
            case STRING:
                final Collator collator = Collator.getInstance(context.getLocale());
                return (left, right) -> collator.compare(((StringValue)left).getValue(), ((StringValue)right).getValue());
            case BOOLEAN:
                return (left, right) -> Boolean.compare(((BooleanValue)left).getValue(), ((BooleanValue)right).getValue());
            case DATE:
            case DATE_TIME:
                final ZoneId zone = context.getTimeZone();
                return Comparator.comparing(value -> DateTimeNormalizer.toInstant(value, zone));
            case TIME:
                return Comparator.comparing(value -> ((TimeValue)value).getValue());
            default:
                return (left, right) -> 0;
        }
    }
}
