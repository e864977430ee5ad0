package com.investigation.linkage.engine;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup from instruments declared in the personal registry (phone number,
 * bank account, wallet address) to the owning person's entity key. Keyed by the raw
 * trimmed identifier, since transaction records reference raw identifiers.
 *
 * Built once by the person stage; later stages only read it.
 */
public final class CrossReferenceIndex {

    private static final CrossReferenceIndex EMPTY = new Builder().build();

    private final Map<String, String> phoneToPerson;
    private final Map<String, String> accountToPerson;
    private final Map<String, String> walletToPerson;

    private CrossReferenceIndex(Builder builder) {
        this.phoneToPerson = Collections.unmodifiableMap(new HashMap<>(builder.phoneToPerson));
        this.accountToPerson = Collections.unmodifiableMap(new HashMap<>(builder.accountToPerson));
        this.walletToPerson = Collections.unmodifiableMap(new HashMap<>(builder.walletToPerson));
    }

    public static CrossReferenceIndex empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> personForPhone(String rawPhone) {
        return lookup(phoneToPerson, rawPhone);
    }

    public Optional<String> personForAccount(String rawAccount) {
        return lookup(accountToPerson, rawAccount);
    }

    public Optional<String> personForWallet(String rawWallet) {
        return lookup(walletToPerson, rawWallet);
    }

    public int size() {
        return phoneToPerson.size() + accountToPerson.size() + walletToPerson.size();
    }

    private static Optional<String> lookup(Map<String, String> map, String raw) {
        if (raw == null) return Optional.empty();
        return Optional.ofNullable(map.get(raw.trim()));
    }

    public static final class Builder {
        private final Map<String, String> phoneToPerson = new HashMap<>();
        private final Map<String, String> accountToPerson = new HashMap<>();
        private final Map<String, String> walletToPerson = new HashMap<>();

        private Builder() {}

        // Later registrations of the same identifier win.
        public Builder phone(String rawPhone, String personKey) {
            phoneToPerson.put(rawPhone.trim(), personKey);
            return this;
        }

        public Builder account(String rawAccount, String personKey) {
            accountToPerson.put(rawAccount.trim(), personKey);
            return this;
        }

        public Builder wallet(String rawWallet, String personKey) {
            walletToPerson.put(rawWallet.trim(), personKey);
            return this;
        }

        public CrossReferenceIndex build() {
            return new CrossReferenceIndex(this);
        }
    }
}
