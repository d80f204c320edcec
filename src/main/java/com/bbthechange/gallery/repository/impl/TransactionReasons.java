package com.bbthechange.gallery.repository.impl;

import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

import java.util.List;

/**
 * Reads per-item cancellation reasons of a cancelled TransactWriteItems call.
 */
final class TransactionReasons {

    static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";
    static final String TRANSACTION_CONFLICT = "TransactionConflict";

    private TransactionReasons() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return true if the transaction item at {@code index} failed its condition expression
     */
    static boolean failedCondition(TransactionCanceledException e, int index) {
        if (!e.hasCancellationReasons()) {
            return false;
        }
        List<CancellationReason> reasons = e.cancellationReasons();
        return index < reasons.size() && CONDITIONAL_CHECK_FAILED.equals(reasons.get(index).code());
    }

    /**
     * @return true if the item at {@code index} lost a race against another in-flight transaction
     */
    static boolean conflicted(TransactionCanceledException e, int index) {
        if (!e.hasCancellationReasons()) {
            return false;
        }
        List<CancellationReason> reasons = e.cancellationReasons();
        return index < reasons.size() && TRANSACTION_CONFLICT.equals(reasons.get(index).code());
    }
}
