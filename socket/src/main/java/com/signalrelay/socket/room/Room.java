package com.signalrelay.socket.room;

import com.signalrelay.socket.session.SignalingConnection;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pairing unit for WebRTC peers.
 * <p>
 * Occupants are only added or removed by {@link RoomRegistry} while it holds
 * the room's map entry; relays read a snapshot without locking.
 * </p>
 */
public class Room {
    private final String id;
    private final long createdAt;
    private final List<SignalingConnection> occupants = new CopyOnWriteArrayList<>();

    Room(String id) {
        this.id = id;
        this.createdAt = System.currentTimeMillis();
    }

    public String getId() {
        return id;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public int size() {
        return occupants.size();
    }

    public boolean isEmpty() {
        return occupants.isEmpty();
    }

    public List<SignalingConnection> getOccupants() {
        return List.copyOf(occupants);
    }

    void add(SignalingConnection connection) {
        occupants.add(connection);
    }

    boolean remove(SignalingConnection connection) {
        return occupants.remove(connection);
    }
}
