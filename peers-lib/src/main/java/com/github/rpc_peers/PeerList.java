// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers;

import com.github.rpc_peers.network.Connector;
import lombok.With;
import org.jetbrains.annotations.TestOnly;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.random.RandomGenerator;

import static com.github.rpc_peers.PeersLogger.LOGGER;

/// A concurrent registry of peers keyed by `host:port`.
///
/// Lists form a tree so that many call routing scopes can share one set of physical connections:
///
/// - The root list owns the registry of `Peer` objects. An address maps to exactly one peer in a tree.
/// - A child list (`newChild`) indexes a subset of its parent's peers. Adding to a child adds to the parent.
/// - A sibling list (`newSibling`) shares its creator's root and parent but starts with an empty index of its
///   own. A sibling of the root has no parent: it takes peers from the root's registry without adding them to
///   the root's index, so its addresses are never selected by `root.get()`.
///
/// Every list guards its index with its own read/write lock. Lookups take the read lock. Insertion takes the
/// write lock and re-checks the index because another thread may have inserted the same address between the
/// read and the write. A list resolves the shared peer from its parent, or from the registry, before it takes
/// its write lock so no list lock is held across another list's work.
public class PeerList {

  /// Create a configuration with default settings.
  public static Config config() {
    return new Config(
        null,                    // connector
        RandomPeerSelector::new, // selectorFactory
        PeerRandom.shared()      // random
    );
  }

  /// A root list with the default random selection strategy.
  public static PeerList root(Connector connector) {
    return config().withConnector(connector).build();
  }

  /// Immutable configuration shared by every list derived from the root it builds.
  ///
  /// @param connector       dials outbound connections for the peers of the tree
  /// @param selectorFactory creates the selector of each list from the random source
  /// @param random          used for selection and for picking among a peer's active connections
  @With
  public record Config(
      Connector connector,
      Function<RandomGenerator, PeerSelector> selectorFactory,
      RandomGenerator random
  ) {
    /// Builds the root list of a new tree.
    public PeerList build() {
      if (connector == null) throw new IllegalStateException("Connector must be specified");
      if (selectorFactory == null) throw new IllegalStateException("PeerSelector factory must be specified");
      if (random == null) throw new IllegalStateException("Random source must be specified");
      return new PeerList(this, null, null);
    }
  }

  private final Config config;
  private final PeerList root;
  // the list that also indexes every peer added here, null for the root and its siblings
  private final PeerList parent;
  private final PeerSelector peerSelector;
  // every peer of the tree by address, only present on the root
  private final ConcurrentMap<String, Peer> registry;

  // guards peersByHostPort and peers
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Peer> peersByHostPort = new HashMap<>();
  private final List<Peer> peers = new ArrayList<>();

  private PeerList(Config config, PeerList root, PeerList parent) {
    this.config = config;
    this.root = root == null ? this : root;
    this.parent = parent;
    this.registry = root == null ? new ConcurrentHashMap<>() : null;
    this.peerSelector = Objects.requireNonNull(config.selectorFactory().apply(config.random()),
        "selectorFactory returned null");
  }

  public boolean isRoot() {
    return root == this;
  }

  /// A list with its own empty index whose peers come from the same root as this list. Adding to a sibling
  /// adds to this list's parent, if it has one, but never to this list. Siblings never double-connect to a host.
  public PeerList newSibling() {
    final var sibling = new PeerList(config, root, parent);
    LOGGER.finer(() -> "Created sibling list of " + this);
    return sibling;
  }

  /// A list whose peers are always also indexed by this list.
  public PeerList newChild() {
    final var child = new PeerList(config, root, this);
    LOGGER.finer(() -> "Created child list of " + this);
    return child;
  }

  /// Adds a peer for `hostPort` if this list does not index one yet, and returns the peer for that address.
  /// Concurrent calls for the same address in the same tree all return the same instance.
  public Peer add(String hostPort) {
    Objects.requireNonNull(hostPort, "hostPort");
    final var existing = lookup(hostPort);
    if (existing != null) {
      return existing;
    }
    final var shared = parent != null ? parent.add(hostPort) : root.resolve(hostPort);
    lock.writeLock().lock();
    try {
      final var raced = peersByHostPort.get(hostPort);
      if (raced != null) {
        return raced;
      }
      index(shared);
      return shared;
    } finally {
      lock.writeLock().unlock();
    }
  }

  // only the root creates peers so that a host is never connected twice
  private Peer resolve(String hostPort) {
    return registry.computeIfAbsent(hostPort, address -> {
      LOGGER.fine(() -> "Created peer " + address);
      return new Peer(config.connector(), address, config.random());
    });
  }

  // caller holds the write lock
  private void index(Peer peer) {
    peersByHostPort.put(peer.hostPort(), peer);
    peers.add(peer);
    LOGGER.finer(() -> "Indexed " + peer.hostPort() + " in " + this);
  }

  private Peer lookup(String hostPort) {
    lock.readLock().lock();
    try {
      return peersByHostPort.get(hostPort);
    } finally {
      lock.readLock().unlock();
    }
  }

  /// Returns a peer chosen by this list's selection strategy.
  ///
  /// @throws NoPeersAvailableException if the list is empty
  public Peer get() throws NoPeersAvailableException {
    lock.readLock().lock();
    try {
      if (peers.isEmpty()) {
        throw new NoPeersAvailableException();
      }
      final var peer = peerSelector.choosePeer(Collections.unmodifiableList(peers));
      LOGGER.finest(() -> "Selected " + peer + " from " + peers.size() + " peers");
      return peer;
    } finally {
      lock.readLock().unlock();
    }
  }

  /// Returns the peer this list indexes for `hostPort`, adding one if there is none.
  public Peer getOrAdd(String hostPort) {
    Objects.requireNonNull(hostPort, "hostPort");
    final var existing = lookup(hostPort);
    if (existing != null) {
      return existing;
    }
    return add(hostPort);
  }

  /// A snapshot of the index. Intended for tests and diagnostics.
  @TestOnly
  public Map<String, Peer> copy() {
    lock.readLock().lock();
    try {
      return Map.copyOf(peersByHostPort);
    } finally {
      lock.readLock().unlock();
    }
  }

  /// The indexed addresses in insertion order.
  public List<String> hostPorts() {
    lock.readLock().lock();
    try {
      return peers.stream().map(Peer::hostPort).toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return peers.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /// Closes the connections of every indexed peer. Peers are shared by reference so this also closes them for
  /// every other list in the tree that indexes them. The index is left as it is and no list lock is held while
  /// the peers close.
  public void close() {
    final List<Peer> snapshot;
    lock.readLock().lock();
    try {
      snapshot = List.copyOf(peers);
    } finally {
      lock.readLock().unlock();
    }
    LOGGER.fine(() -> "Closing " + snapshot.size() + " peers of " + this);
    snapshot.forEach(Peer::close);
  }

  @Override
  public String toString() {
    return "PeerList@" + Integer.toHexString(System.identityHashCode(this)) + (isRoot() ? "[root]" : "");
  }
}
