package com.dailyBrief.accountBrief.record.model;

import com.dailyBrief.accountBrief.account.model.AccountClassification;

/**
 * A normalized record of any kind. Every kind carries the classification of the
 * account it came from.
 */
public interface CanonicalRecord {

    AccountClassification getAccountType();
}
