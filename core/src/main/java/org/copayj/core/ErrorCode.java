/*
 * Copyright 2026 copayj contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.copayj.core;

public enum ErrorCode {
    INVALID_ADDRESS(Category.VALIDATION, "Invalid address"),
    INCORRECT_ADDRESS_NETWORK(Category.VALIDATION, "Incorrect address network"),
    INVALID_AMOUNT(Category.VALIDATION, "Invalid amount"),
    INVALID_FEE_RATE(Category.VALIDATION, "Invalid fee per KB"),
    SCRIPT_TYPE(Category.VALIDATION, "Script must be a valid data type"),
    SCRIPT_OP_RETURN(Category.VALIDATION, "The only supported script is OP_RETURN"),
    SCRIPT_OP_RETURN_AMOUNT(Category.VALIDATION, "Amount for OP_RETURN output must be 0"),
    DUST_AMOUNT(Category.VALIDATION, "Amount below dust threshold"),
    TX_MAX_SIZE_EXCEEDED(Category.VALIDATION, "TX exceeds maximum allowed size"),
    TX_FEE_TOO_HIGH(Category.VALIDATION, "TX fee exceeds maximum allowed fee"),
    NO_INPUT_PATHS(Category.VALIDATION, "Proposal has no input paths"),

    INSUFFICIENT_FUNDS(Category.FUNDS, "Insufficient funds"),
    INSUFFICIENT_FUNDS_FOR_FEE(Category.FUNDS, "Insufficient funds for fee"),
    LOCKED_FUNDS(Category.FUNDS, "Funds are locked by pending transaction proposals"),
    UNAVAILABLE_UTXOS(Category.FUNDS, "Some inputs of this proposal are no longer available"),

    SIGNATURE_COUNT_MISMATCH(Category.INTEGRITY, "Number of signatures does not match number of inputs"),
    BAD_SIGNATURES(Category.INTEGRITY, "Bad signatures"),
    PROPOSAL_HASH_MISMATCH(Category.INTEGRITY, "Proposal signature does not match its content"),
    NOT_AUTHORIZED(Category.INTEGRITY, "Copayer is not a member of this wallet"),

    TX_NOT_FOUND(Category.STATE, "Transaction proposal not found"),
    TX_NOT_PENDING(Category.STATE, "The transaction proposal is not pending"),
    TX_NOT_ACCEPTED(Category.STATE, "The transaction proposal is not accepted"),
    TX_MISSING_ID(Category.STATE, "The transaction proposal has no transaction id"),
    COPAYER_VOTED(Category.STATE, "Copayer already voted on this transaction proposal"),
    UNSUPPORTED_FORMAT(Category.STATE, "Unsupported transaction proposal format"),

    MULTI_TX_UNSUPPORTED(Category.CAPABILITY, "Multiple transactions are not supported on this chain"),
    UNSUPPORTED_CHAIN(Category.CAPABILITY, "Operation not supported for this chain"),
    UNSUPPORTED_SCRIPT_TYPE(Category.CAPABILITY, "Operation not supported for this script type"),

    WALLET_BUSY(Category.BUSY, "Wallet is busy, try later"),

    INTERNAL(Category.INTERNAL, "Internal error");

    public enum Category {
        VALIDATION,
        FUNDS,
        INTEGRITY,
        STATE,
        CAPABILITY,
        BUSY,
        INTERNAL
    }

    private final Category category;
    private final String defaultMessage;

    ErrorCode(Category category, String defaultMessage) {
        this.category = category;
        this.defaultMessage = defaultMessage;
    }

    public Category getCategory() {
        return category;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
