// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.identity;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.DebugLogger;
import sh.tessera.core.agent.AgentId;
import sh.tessera.core.agent.MetadataEntry;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.crypto.eip712.Eip712Domain;
import sh.tessera.core.error.InvalidInputException;
import sh.tessera.core.error.InvalidStateException;
import sh.tessera.core.error.NotFoundException;
import sh.tessera.core.error.RegistryError;
import sh.tessera.core.error.UnauthorizedException;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.primitives.Hex;
import sh.tessera.registry.Ledger;
import sh.tessera.registry.RegistryLimits;
import sh.tessera.registry.event.AgentApproval;
import sh.tessera.registry.event.AgentDeactivated;
import sh.tessera.registry.event.AgentReactivated;
import sh.tessera.registry.event.AgentRegistered;
import sh.tessera.registry.event.AgentTransferred;
import sh.tessera.registry.event.AgentUriUpdated;
import sh.tessera.registry.event.AgentWalletCleared;
import sh.tessera.registry.event.AgentWalletSet;
import sh.tessera.registry.event.MetadataSet;
import sh.tessera.registry.event.OperatorApproval;

import static sh.tessera.registry.RegistryChecks.requireCaller;
import static sh.tessera.registry.RegistryChecks.requireMaxLength;
import static sh.tessera.registry.RegistryChecks.requireNonZero;
import static sh.tessera.registry.RegistryChecks.requireText;

/**
 * Mints agent identities and tracks who controls them.
 *
 * <p>Agents are owned like non-fungible tokens: one owner, an optional approved
 * address, and owner-wide operators. On top of that an agent carries a URI, key/value
 * metadata, an optional delegated wallet and an active flag.
 *
 * <p>Authorization:
 * <ul>
 * <li>URI, metadata, wallet and approval changes: owner, approved address or operator</li>
 * <li>{@link #deactivate}/{@link #reactivate}: owner only</li>
 * <li>transfers: owner, approved address or operator; {@code from} must be the owner</li>
 * </ul>
 *
 * <p>A transfer always clears the delegated wallet and the per-agent approval.
 *
 * <p>Example:
 * <pre>{@code
 * AgentId agent = identity.register(owner, "https://agents.example/alpha.json");
 * identity.setMetadata(owner, agent, "model", "v2".getBytes(StandardCharsets.UTF_8));
 * identity.safeTransferFrom(owner, owner, buyer, agent);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class IdentityRegistry implements AgentDirectory {

    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);

    /** Metadata key that mirrors the delegated wallet; only the wallet operations write it. */
    public static final String AGENT_WALLET_KEY = "agentWallet";

    private static final byte[] NO_DATA = new byte[0];

    private final Ledger ledger;
    private final AgentStore store;
    private final ControlProofVerifier verifier;
    private final Address registryAddress;

    public IdentityRegistry(final Ledger ledger, final AgentStore store, final ControlProofVerifier verifier) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.store = Objects.requireNonNull(store, "store");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.registryAddress = ledger.config().identityAddress();
    }

    public IdentityRegistry(final Ledger ledger) {
        this(ledger, new AgentStore(), new Eip712ControlProofVerifier());
    }

    public Address address() {
        return registryAddress;
    }

    public String name() {
        return ledger.config().identityName();
    }

    public String symbol() {
        return ledger.config().identitySymbol();
    }

    // ═══════════════════════════════════════════════════════════════════
    // Registration
    // ═══════════════════════════════════════════════════════════════════

    public AgentId register(final Address caller) {
        return register(caller, "", List.of());
    }

    public AgentId register(final Address caller, final String agentUri) {
        return register(caller, agentUri, List.of());
    }

    /**
     * Registers an agent from parallel key and value lists.
     *
     * @param caller   the future owner
     * @param agentUri registration document URI
     * @param keys     metadata keys
     * @param values   metadata values, same size as {@code keys}
     * @return the new agent id
     * @throws InvalidInputException if the lists differ in size or an entry is invalid
     */
    public AgentId register(final Address caller, final String agentUri,
                            final List<String> keys, final List<byte[]> values) {
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(values, "values");
        if (keys.size() != values.size()) {
            throw InvalidInputException.lengthMismatch("keys", keys.size(), "values", values.size());
        }
        final List<MetadataEntry> entries = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            entries.add(MetadataEntry.of(keys.get(i), values.get(i)));
        }
        return register(caller, agentUri, entries);
    }

    /**
     * Registers an agent owned by {@code caller}. Ids start at 1 and are never reused.
     *
     * @param caller   the future owner
     * @param agentUri registration document URI, may be empty
     * @param metadata initial metadata entries
     * @return the new agent id
     */
    public AgentId register(final Address caller, final String agentUri, final List<MetadataEntry> metadata) {
        requireCaller(caller);
        Objects.requireNonNull(metadata, "metadata");
        final RegistryLimits limits = ledger.limits();
        final String uri = requireMaxLength(agentUri, limits.maxUriLength(), "agentUri");
        for (MetadataEntry entry : metadata) {
            requireMetadataKey(entry.key());
        }

        return ledger.transact("identity.register", () -> {
            final AgentId agentId = store.nextAgentId();
            store.mint(new AgentRecord(agentId, caller, uri, null, null, true, ledger.timestamp()));
            ledger.emit(new AgentRegistered(agentId, caller, uri, ledger.timestamp()));
            for (MetadataEntry entry : metadata) {
                store.putMetadata(agentId, entry.key(), entry.value());
                ledger.emit(new MetadataSet(agentId, entry.key(), Hex.encode(entry.value()), caller));
            }
            log.debug("Registered {} for {}", agentId, caller);
            DebugLogger.logOperation("[REGISTER] agent=%s owner=%s uri=%s", agentId, caller, uri);
            return agentId;
        });
    }

    // ═══════════════════════════════════════════════════════════════════
    // URI and metadata
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Replaces the agent URI and clears any stored document hash.
     */
    public void setAgentUri(final Address caller, final AgentId agentId, final String agentUri) {
        setAgentUri(caller, agentId, agentUri, null);
    }

    public void setAgentUri(final Address caller, final AgentId agentId, final String agentUri,
                            final @Nullable Hash metadataHash) {
        requireCaller(caller);
        final String uri = requireMaxLength(agentUri, ledger.limits().maxUriLength(), "agentUri");
        ledger.execute("identity.setAgentUri", () -> {
            final AgentRecord record = requireAgent(agentId);
            requireManager(record, caller);
            store.update(record.withUri(uri, metadataHash));
            ledger.emit(new AgentUriUpdated(agentId, uri, metadataHash, caller));
        });
    }

    /**
     * Writes one metadata entry.
     *
     * @throws InvalidInputException if the key is empty, too long, or {@value #AGENT_WALLET_KEY}
     */
    public void setMetadata(final Address caller, final AgentId agentId, final String key, final byte[] value) {
        requireCaller(caller);
        requireMetadataKey(key);
        Objects.requireNonNull(value, "value");
        final byte[] copy = value.clone();
        ledger.execute("identity.setMetadata", () -> {
            final AgentRecord record = requireAgent(agentId);
            requireManager(record, caller);
            store.putMetadata(agentId, key, copy);
            ledger.emit(new MetadataSet(agentId, key, Hex.encode(copy), caller));
        });
    }

    // ═══════════════════════════════════════════════════════════════════
    // Delegated wallet
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Signing domain for wallet binding proofs of this deployment.
     */
    public Eip712Domain walletBindingDomain() {
        return WalletBindings.domain(ledger.config().identityRegistryId());
    }

    /**
     * Binds a delegated wallet after verifying the wallet's signed consent.
     *
     * <p>The proof must be an {@link AgentWalletBinding} over the agent's current
     * {@link #walletNonce}, signed by {@code wallet} under {@link #walletBindingDomain()}.
     * A successful binding consumes the nonce.
     *
     * @param caller    owner, approved address or operator
     * @param agentId   the agent
     * @param wallet    the wallet to bind
     * @param deadline  unix time after which the proof is rejected
     * @param signature the wallet's signature
     * @throws InvalidStateException with {@link RegistryError#PROOF_EXPIRED} or
     *                               {@link RegistryError#INVALID_PROOF}
     */
    public void setAgentWallet(final Address caller, final AgentId agentId, final Address wallet,
                               final long deadline, final Signature signature) {
        requireCaller(caller);
        requireNonZero(wallet, "wallet");
        Objects.requireNonNull(signature, "signature");
        ledger.execute("identity.setAgentWallet", () -> {
            final AgentRecord record = requireAgent(agentId);
            requireManager(record, caller);
            if (deadline < ledger.timestamp()) {
                throw new InvalidStateException(RegistryError.PROOF_EXPIRED,
                        "wallet proof for %s expired at %d, now %d".formatted(agentId, deadline, ledger.timestamp()));
            }
            final BigInteger nonce = store.walletNonce(agentId);
            final AgentWalletBinding binding = WalletBindings.binding(agentId, wallet, nonce, deadline);
            if (!verifier.verify(binding, walletBindingDomain(), signature)) {
                throw new InvalidStateException(RegistryError.INVALID_PROOF,
                        "signature does not prove control of " + wallet + " for " + agentId);
            }
            store.update(record.withWallet(wallet));
            store.consumeWalletNonce(agentId);
            ledger.emit(new AgentWalletSet(agentId, wallet, nonce, caller));
            log.debug("Bound wallet {} to {} (nonce {})", wallet, agentId, nonce);
        });
    }

    public void unsetAgentWallet(final Address caller, final AgentId agentId) {
        requireCaller(caller);
        ledger.execute("identity.unsetAgentWallet", () -> {
            final AgentRecord record = requireAgent(agentId);
            requireManager(record, caller);
            final Address previous = record.wallet();
            if (previous == null) {
                throw new InvalidStateException(RegistryError.WALLET_NOT_SET, agentId + " has no delegated wallet");
            }
            store.update(record.withWallet(null));
            ledger.emit(new AgentWalletCleared(agentId, previous, caller));
        });
    }

    /**
     * Returns the delegated wallet, or {@link Address#ZERO} when none is bound.
     */
    public Address agentWallet(final AgentId agentId) {
        return ledger.read(() -> {
            final Address wallet = requireAgent(agentId).wallet();
            return wallet == null ? Address.ZERO : wallet;
        });
    }

    public BigInteger walletNonce(final AgentId agentId) {
        return ledger.read(() -> {
            requireAgent(agentId);
            return store.walletNonce(agentId);
        });
    }

    // ═══════════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════════

    public void deactivate(final Address caller, final AgentId agentId) {
        setActive(caller, agentId, false);
    }

    public void reactivate(final Address caller, final AgentId agentId) {
        setActive(caller, agentId, true);
    }

    private void setActive(final Address caller, final AgentId agentId, final boolean active) {
        requireCaller(caller);
        ledger.execute(active ? "identity.reactivate" : "identity.deactivate", () -> {
            final AgentRecord record = requireAgent(agentId);
            if (!record.owner().equals(caller)) {
                throw UnauthorizedException.notAuthorized(caller, "the owner of " + agentId);
            }
            if (record.active() == active) {
                throw new InvalidStateException(
                        active ? RegistryError.ALREADY_ACTIVE : RegistryError.ALREADY_INACTIVE,
                        agentId + " is already " + (active ? "active" : "inactive"));
            }
            store.update(record.withActive(active));
            if (active) {
                ledger.emit(new AgentReactivated(agentId, ledger.timestamp()));
            } else {
                ledger.emit(new AgentDeactivated(agentId, ledger.timestamp()));
            }
        });
    }

    // ═══════════════════════════════════════════════════════════════════
    // Approvals and transfers
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Sets the single address allowed to transfer and manage an agent. Pass
     * {@link Address#ZERO} to revoke.
     */
    public void approve(final Address caller, final Address to, final AgentId agentId) {
        requireCaller(caller);
        Objects.requireNonNull(to, "to");
        ledger.execute("identity.approve", () -> {
            final AgentRecord record = requireAgent(agentId);
            if (!record.owner().equals(caller) && !store.isOperator(record.owner(), caller)) {
                throw UnauthorizedException.notAuthorized(caller, "the owner or an operator of " + agentId);
            }
            store.setApproval(agentId, to);
            ledger.emit(new AgentApproval(agentId, record.owner(), to));
        });
    }

    public void setApprovalForAll(final Address caller, final Address operator, final boolean approved) {
        requireCaller(caller);
        requireNonZero(operator, "operator");
        ledger.execute("identity.setApprovalForAll", () -> {
            store.setOperator(caller, operator, approved);
            ledger.emit(new OperatorApproval(caller, operator, approved));
        });
    }

    public Address getApproved(final AgentId agentId) {
        return ledger.read(() -> {
            requireAgent(agentId);
            return store.approval(agentId).orElse(Address.ZERO);
        });
    }

    public boolean isApprovedForAll(final Address owner, final Address operator) {
        return ledger.read(() -> store.isOperator(owner, operator));
    }

    public void transferFrom(final Address caller, final Address from, final Address to, final AgentId agentId) {
        transfer("identity.transferFrom", caller, from, to, agentId, false, NO_DATA);
    }

    public void safeTransferFrom(final Address caller, final Address from, final Address to, final AgentId agentId) {
        safeTransferFrom(caller, from, to, agentId, NO_DATA);
    }

    /**
     * Transfers an agent, requiring acknowledgment when {@code to} hosts an
     * {@link AgentReceiver}.
     *
     * @throws InvalidStateException with {@link RegistryError#UNSAFE_RECIPIENT} if the
     *                               receiver declines
     */
    public void safeTransferFrom(final Address caller, final Address from, final Address to,
                                 final AgentId agentId, final byte[] data) {
        Objects.requireNonNull(data, "data");
        transfer("identity.safeTransferFrom", caller, from, to, agentId, true, data.clone());
    }

    private void transfer(final String operation, final Address caller, final Address from, final Address to,
                          final AgentId agentId, final boolean safe, final byte[] data) {
        requireCaller(caller);
        requireNonZero(from, "from");
        requireNonZero(to, "to");
        ledger.execute(operation, () -> {
            final AgentRecord record = requireAgent(agentId);
            if (!record.owner().equals(from)) {
                throw UnauthorizedException.notAuthorized(from, "the owner of " + agentId);
            }
            requireManager(record, caller);
            if (safe) {
                ledger.receiverAt(to).ifPresent(receiver -> {
                    if (!ledger.callOut(() -> receiver.onAgentReceived(caller, from, agentId, data.clone()))) {
                        throw new InvalidStateException(RegistryError.UNSAFE_RECIPIENT,
                                to + " did not accept " + agentId);
                    }
                });
            }

            store.setApproval(agentId, Address.ZERO);
            store.update(record.withOwner(to));
            if (record.wallet() != null) {
                ledger.emit(new AgentWalletCleared(agentId, record.wallet(), caller));
            }
            ledger.emit(new AgentTransferred(agentId, from, to));
            log.debug("Transferred {} from {} to {}", agentId, from, to);
            DebugLogger.logOperation("[TRANSFER] agent=%s from=%s to=%s", agentId, from, to);
        });
    }

    // ═══════════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════════

    @Override
    public boolean exists(final AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        return ledger.read(() -> store.get(agentId).isPresent());
    }

    @Override
    public Address ownerOf(final AgentId agentId) {
        return ledger.read(() -> requireAgent(agentId).owner());
    }

    @Override
    public Optional<Address> delegateOf(final AgentId agentId) {
        return ledger.read(() -> requireAgent(agentId).walletAddress());
    }

    @Override
    public boolean isActive(final AgentId agentId) {
        return ledger.read(() -> requireAgent(agentId).active());
    }

    @Override
    public boolean isAuthority(final AgentId agentId, final Address address) {
        Objects.requireNonNull(address, "address");
        return ledger.read(() -> {
            final AgentRecord record = requireAgent(agentId);
            return record.owner().equals(address) || address.equals(record.wallet());
        });
    }

    public AgentRecord agent(final AgentId agentId) {
        return ledger.read(() -> requireAgent(agentId));
    }

    public String agentUri(final AgentId agentId) {
        return ledger.read(() -> requireAgent(agentId).agentUri());
    }

    public Optional<Hash> metadataHash(final AgentId agentId) {
        return ledger.read(() -> Optional.ofNullable(requireAgent(agentId).metadataHash()));
    }

    /**
     * Reads one metadata entry. The {@value #AGENT_WALLET_KEY} key reports the
     * delegated wallet's 20 address bytes.
     *
     * @return a copy of the value, or empty when the key was never set
     */
    public Optional<byte[]> metadata(final AgentId agentId, final String key) {
        Objects.requireNonNull(key, "key");
        return ledger.read(() -> {
            final AgentRecord record = requireAgent(agentId);
            if (AGENT_WALLET_KEY.equals(key)) {
                return record.walletAddress().map(Address::toBytes);
            }
            return store.metadata(agentId, key);
        });
    }

    public long balanceOf(final Address owner) {
        requireNonZero(owner, "owner");
        return ledger.read(() -> (long) store.ownedBy(owner).size());
    }

    public long totalAgents() {
        return ledger.read(store::size);
    }

    public List<AgentId> agentsOf(final Address owner) {
        Objects.requireNonNull(owner, "owner");
        return ledger.read(() -> store.ownedBy(owner));
    }

    // ═══════════════════════════════════════════════════════════════════
    // Checks
    // ═══════════════════════════════════════════════════════════════════

    private AgentRecord requireAgent(final AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        return store.get(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
    }

    private void requireManager(final AgentRecord record, final Address caller) {
        final boolean manager = record.owner().equals(caller)
                || store.approval(record.agentId()).map(caller::equals).orElse(false)
                || store.isOperator(record.owner(), caller);
        if (!manager) {
            throw UnauthorizedException.notAuthorized(caller, "the owner, approved address or an operator of "
                    + record.agentId());
        }
    }

    private void requireMetadataKey(final String key) {
        requireText(key, ledger.limits().maxMetadataKeyLength(), "metadata key");
        if (AGENT_WALLET_KEY.equals(key)) {
            throw InvalidInputException.reservedKey(key);
        }
    }
}
