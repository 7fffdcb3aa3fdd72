package com.example.alarm.realtime;

import java.io.IOException;

/** Outbound side of one realtime client connection. Sends for one channel never overlap. */
public interface RealtimeChannel {

  void send(String frame) throws IOException;

  void close();
}
