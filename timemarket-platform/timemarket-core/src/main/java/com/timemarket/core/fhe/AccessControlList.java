package com.timemarket.core.fhe;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Who may obtain plaintext for which handle. Grants are permanent; public
 * decryptability is a separate flag on the handle.
 */
public class AccessControlList {

    private final Set<AclGrant> grants = ConcurrentHashMap.newKeySet();
    private final List<AclGrant> grantOrder = new CopyOnWriteArrayList<>();
    private final Set<EncryptedHandle> publiclyDecryptable = ConcurrentHashMap.newKeySet();

    public void allow(EncryptedHandle handle, String subject) {
        Objects.requireNonNull(handle, "Handle cannot be null");
        Objects.requireNonNull(subject, "Subject cannot be null");
        AclGrant grant = new AclGrant(subject.toLowerCase(Locale.ROOT), handle);
        if (grants.add(grant)) {
            grantOrder.add(grant);
        }
    }

    public boolean isAllowed(EncryptedHandle handle, String subject) {
        return subject != null && grants.contains(new AclGrant(subject.toLowerCase(Locale.ROOT), handle));
    }

    public void makePubliclyDecryptable(EncryptedHandle handle) {
        Objects.requireNonNull(handle, "Handle cannot be null");
        publiclyDecryptable.add(handle);
    }

    public boolean isPubliclyDecryptable(EncryptedHandle handle) {
        return publiclyDecryptable.contains(handle);
    }

    public List<AclGrant> grantsFor(EncryptedHandle handle) {
        return grantOrder.stream().filter(g -> g.handle().equals(handle)).toList();
    }

    public List<AclGrant> grants() {
        return List.copyOf(grantOrder);
    }
}
