package com.signalrelay.socket.room;

import com.signalrelay.core.msg.SignalMessages;
import com.signalrelay.socket.session.SignalingConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rooms on this node keyed by room id.
 * <p>
 * Every membership change for a room runs inside {@link ConcurrentHashMap#compute}
 * on that room's key, so overlapping joins and leaves for the same id are applied
 * one at a time. A room entry exists iff it has at least one occupant.
 * </p>
 * <p>
 * The {@code init} reply is queued to the joiner before the joiner becomes
 * visible to relays, so a peer's first payload can never overtake it.
 * </p>
 */
public class RoomRegistry {
    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final int maxRoomSize;
    private final int maxRoomIdLength;

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    public RoomRegistry(int maxRoomSize, int maxRoomIdLength) {
        this.maxRoomSize = maxRoomSize;
        this.maxRoomIdLength = maxRoomIdLength;
    }

    public boolean isValidRoomId(String roomId) {
        return roomId != null && !roomId.isEmpty() && roomId.length() <= maxRoomIdLength;
    }

    /**
     * Admits a connection into a room, creating the room on first join.
     *
     * @param connection joiner, must not already be in a room
     * @param roomId     validated room id
     * @return what happened; on {@link JoinOutcome#FULL} and
     *         {@link JoinOutcome#ALREADY_IN_ROOM} the registry is unchanged
     */
    public JoinOutcome join(SignalingConnection connection, String roomId) {
        if (!isValidRoomId(roomId)) {
            throw new IllegalArgumentException("Invalid room id: " + roomId);
        }
        if (connection.getRoomId() != null) {
            return JoinOutcome.ALREADY_IN_ROOM;
        }

        JoinOutcome[] outcome = new JoinOutcome[1];
        rooms.compute(roomId, (id, room) -> {
            if (room == null) {
                Room created = new Room(id);
                admit(created, connection, true);
                outcome[0] = JoinOutcome.CREATED;
                return created;
            }
            if (room.size() >= maxRoomSize) {
                outcome[0] = JoinOutcome.FULL;
                return room;
            }
            admit(room, connection, false);
            outcome[0] = JoinOutcome.JOINED;
            return room;
        });

        switch (outcome[0]) {
            case CREATED -> log.info("Created room {} for {}", roomId, connection.getRemoteAddress());
            case JOINED -> log.info("{} joined room {} ({} occupants)",
                connection.getRemoteAddress(), roomId, occupancy(roomId));
            case FULL -> log.warn("{} attempted to join full room {}", connection.getRemoteAddress(), roomId);
            default -> {
            }
        }
        return outcome[0];
    }

    private void admit(Room room, SignalingConnection connection, boolean initiator) {
        connection.assignRoom(room.getId(), initiator);
        connection.send(SignalMessages.init(initiator));
        room.add(connection);
    }

    /**
     * Removes a connection from its room, deleting the room when it empties.
     *
     * @return true if this call deleted the room
     */
    public boolean leave(SignalingConnection connection) {
        String roomId = connection.getRoomId();
        if (roomId == null) {
            return false;
        }

        boolean[] deleted = new boolean[1];
        rooms.computeIfPresent(roomId, (id, room) -> {
            room.remove(connection);
            if (room.isEmpty()) {
                deleted[0] = true;
                return null;
            }
            return room;
        });
        connection.clearRoom();

        if (deleted[0]) {
            log.info("Room {} deleted (empty)", roomId);
        } else {
            log.debug("Connection {} left room {} ({} occupants)", connection.getId(), roomId, occupancy(roomId));
        }
        return deleted[0];
    }

    /**
     * Other occupants of the connection's room.
     */
    public List<SignalingConnection> peersOf(SignalingConnection connection) {
        String roomId = connection.getRoomId();
        if (roomId == null) {
            return List.of();
        }
        Room room = rooms.get(roomId);
        if (room == null) {
            return List.of();
        }
        return room.getOccupants().stream()
            .filter(occupant -> occupant != connection)
            .toList();
    }

    public Optional<Room> getRoom(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public int occupancy(String roomId) {
        Room room = rooms.get(roomId);
        return room == null ? 0 : room.size();
    }

    public int roomCount() {
        return rooms.size();
    }
}
