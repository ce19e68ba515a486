package com.wagerengine.providers;

import com.wagerengine.access.EngineControl;
import com.wagerengine.common.exception.CollaboratorNotLinkedException;
import com.wagerengine.common.exception.UnknownCollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the collaborators currently linked in {@link EngineControl}.
 *
 * Entry points call {@link #resolve} once; downstream code receives either a concrete
 * collaborator or {@link IdentityRegistry#UNLINKED} and never checks for presence again.
 */
@Component
@Slf4j
public class Collaborators {

    private final Map<String, PeggedAssetMinter> minters;
    private final Map<String, IdentityRegistry> registries;

    public Collaborators(Map<String, PeggedAssetMinter> minters,
                         Map<String, IdentityRegistry> registries) {
        this.minters = minters;
        this.registries = registries;
        log.info("Available collaborators: minters={}, registries={}", minters.keySet(), registries.keySet());
    }

    public Linked resolve(EngineControl control) {
        PeggedAssetMinter minter = lookup(minters, control.getLinkedMinter(), "minter");
        IdentityRegistry registry = lookup(registries, control.getLinkedRegistry(), "identity registry");
        return new Linked(minter, registry == null ? IdentityRegistry.UNLINKED : registry);
    }

    /**
     * Validate a reference before it is stored. Blank means unlink.
     */
    public void requireKnownMinter(String ref) {
        if (!isBlank(ref) && !minters.containsKey(ref)) {
            throw new UnknownCollaboratorException("minter", ref, minters.keySet());
        }
    }

    public void requireKnownRegistry(String ref) {
        if (!isBlank(ref) && !registries.containsKey(ref)) {
            throw new UnknownCollaboratorException("identity registry", ref, registries.keySet());
        }
    }

    private static <T> T lookup(Map<String, T> beans, String ref, String kind) {
        if (isBlank(ref)) {
            return null;
        }
        T bean = beans.get(ref);
        if (bean == null) {
            // A stored link whose bean is gone is treated as unlinked.
            log.warn("Linked {} '{}' is not available", kind, ref);
        }
        return bean;
    }

    static boolean isBlank(String ref) {
        return ref == null || ref.isBlank();
    }

    /**
     * Collaborators for one request.
     */
    public static final class Linked {

        private final PeggedAssetMinter minter;
        private final IdentityRegistry registry;

        Linked(PeggedAssetMinter minter, IdentityRegistry registry) {
            this.minter = minter;
            this.registry = registry;
        }

        public Optional<PeggedAssetMinter> minter() {
            return Optional.ofNullable(minter);
        }

        public PeggedAssetMinter requireMinter() {
            if (minter == null) {
                throw new CollaboratorNotLinkedException("Pegged asset minter");
            }
            return minter;
        }

        /**
         * Never null: {@link IdentityRegistry#UNLINKED} when no registry is linked.
         */
        public IdentityRegistry registry() {
            return registry;
        }

        public boolean registryLinked() {
            return registry != IdentityRegistry.UNLINKED;
        }
    }
}
