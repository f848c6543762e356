package com.sealpost.store;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * One cached messaging state per user. The payload is JSON holding the encrypted envelopes as
 * received from relays; no decrypted content is ever written here.
 */
@Table("dm_cache")
public class SyncCacheEntity {

    /** Hex public key of the local user. */
    @PrimaryKey("user_pubkey")
    public String userPubkey;

    @Column("payload")
    public String payload;

    /** Relay mode and discovery relays in effect when the payload was written. */
    @Column("settings_fingerprint")
    public String settingsFingerprint;

    @Column("format_version")
    public int formatVersion;

    @Column("updated_at")
    public long updatedAt;
}
