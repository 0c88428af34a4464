package com.example.docnotify.engine.service;

import com.example.docnotify.engine.model.RoomRecord;
import java.util.Optional;

public interface RoomResolver {

  Optional<RoomRecord> findRoomById(String roomId);
}
