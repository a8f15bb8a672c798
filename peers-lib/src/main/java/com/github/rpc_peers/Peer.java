// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers;

import com.github.rpc_peers.network.*;
import io.grpc.Context;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.random.RandomGenerator;

import static com.github.rpc_peers.PeersLogger.LOGGER;

/// A single remote service or client with a unique `host:port`, together with the connections to it.
///
/// Inbound connections are those the remote side opened and a listener handed to us. Outbound connections are
/// those this peer dialed through the `Connector`. Both kinds may carry calls. A peer with no connections is
/// valid: the first call dials one.
///
/// Peers are only created by the root `PeerList` of a tree, so there is exactly one instance per address in a
/// tree. A peer never references a list, only the connector.
public class Peer {
  private final Connector connector;
  private final String hostPort;
  private final RandomGenerator random;

  // guards both connection lists
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<Connection> inboundConnections = new ArrayList<>();
  private final List<Connection> outboundConnections = new ArrayList<>();

  Peer(Connector connector, String hostPort, RandomGenerator random) {
    this.connector = connector;
    this.hostPort = hostPort;
    this.random = random;
  }

  /// The `host:port` used to connect to this peer.
  public String hostPort() {
    return hostPort;
  }

  /// The connections whose state is currently active, inbound first.
  /// TODO drop connections that report CLOSED here instead of keeping them for the life of the peer
  public List<Connection> activeConnections() {
    final var active = new ArrayList<Connection>();
    lock.readLock().lock();
    try {
      forEachConnection(c -> {
        if (c.isActive()) {
          active.add(c);
        }
      });
    } finally {
      lock.readLock().unlock();
    }
    return active;
  }

  /// Returns an active connection to this peer, chosen at random when there are several. If no connection is
  /// active a new outbound connection is dialed and returned. Dial failures are not retried.
  public Connection getConnection(Context context) throws IOException, InvalidConnectionStateException {
    final var active = activeConnections();
    if (!active.isEmpty()) {
      final var chosen = active.get(random.nextInt(active.size()));
      LOGGER.finest(() -> hostPort + " reusing one of " + active.size() + " active connections");
      return chosen;
    }
    LOGGER.finer(() -> hostPort + " has no active connections, dialing");
    return connect(context);
  }

  /// Registers a connection accepted from the remote side.
  ///
  /// @throws InvalidConnectionStateException unless the connection is active or starting to close
  public void addInboundConnection(Connection connection) throws InvalidConnectionStateException {
    checkCanRegister(connection, "inbound");
    lock.writeLock().lock();
    try {
      inboundConnections.add(connection);
    } finally {
      lock.writeLock().unlock();
    }
    LOGGER.finer(() -> hostPort + " added inbound connection " + connection);
  }

  /// Registers an outbound connection.
  ///
  /// @throws InvalidConnectionStateException unless the connection is active or starting to close
  public void addOutboundConnection(Connection connection) throws InvalidConnectionStateException {
    checkCanRegister(connection, "outbound");
    lock.writeLock().lock();
    try {
      outboundConnections.add(connection);
    } finally {
      lock.writeLock().unlock();
    }
    LOGGER.finer(() -> hostPort + " added outbound connection " + connection);
  }

  private void checkCanRegister(Connection connection, String direction) throws InvalidConnectionStateException {
    final var state = connection.state();
    if (!state.canRegister()) {
      LOGGER.warning(() -> hostPort + " rejected " + direction + " connection in state " + state);
      throw new InvalidConnectionStateException(state);
    }
  }

  /// Dials a new outbound connection with the connector's current options and registers it. No lock is held
  /// while dialing. A context that is already done fails before the connector is called; one that ends while
  /// the dial is outstanding is left to the connector to observe.
  public Connection connect(Context context) throws IOException, InvalidConnectionStateException {
    ContextDoneException.throwIfDone(context);
    final Connection connection;
    try {
      connection = connector.connect(context, hostPort, connector.connectionOptions());
    } catch (IOException e) {
      LOGGER.warning(() -> "Failed to connect to " + hostPort + ": " + e.getMessage());
      throw e;
    }
    addOutboundConnection(connection);
    LOGGER.fine(() -> "Connected to " + hostPort);
    return connection;
  }

  /// Starts a new call to this specific peer. The returned call is used to write the arguments.
  ///
  /// @param callOptions may be null in which case `CallOptions.DEFAULT` is used
  public OutboundCall beginCall(Context context, String serviceName, String operationName,
                                CallOptions callOptions) throws IOException, InvalidConnectionStateException {
    final var connection = getConnection(context);
    final var options = callOptions == null ? CallOptions.DEFAULT : callOptions;
    LOGGER.finest(() -> "Calling " + serviceName + "::" + operationName + " on " + hostPort);
    return connection.beginCall(context, serviceName, options, operationName);
  }

  public List<Connection> inboundConnections() {
    lock.readLock().lock();
    try {
      return List.copyOf(inboundConnections);
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<Connection> outboundConnections() {
    lock.readLock().lock();
    try {
      return List.copyOf(outboundConnections);
    } finally {
      lock.readLock().unlock();
    }
  }

  private void forEachConnection(Consumer<Connection> action) {
    inboundConnections.forEach(action);
    outboundConnections.forEach(action);
  }

  /// Closes every inbound then every outbound connection. The lists are left as they are.
  public void close() {
    final var connections = new ArrayList<Connection>();
    lock.readLock().lock();
    try {
      forEachConnection(connections::add);
    } finally {
      lock.readLock().unlock();
    }
    LOGGER.fine(() -> "Closing " + connections.size() + " connections to " + hostPort);
    connections.forEach(Connection::close);
  }

  @Override
  public String toString() {
    return "Peer[" + hostPort + "]";
  }
}
