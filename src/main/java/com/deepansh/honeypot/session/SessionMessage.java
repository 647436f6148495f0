package com.deepansh.honeypot.session;

import com.deepansh.honeypot.model.Sender;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "session_messages")
@CompoundIndex(name = "session_seq", def = "{'sessionId': 1, 'seq': 1}", unique = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionMessage {

    @Id
    private String id;

    private String sessionId;

    /** 1-based insertion order within the session */
    private int seq;

    private Sender sender;
    private String text;
    private Instant timestamp;

    /** True when the honeypot produced this message */
    private boolean response;

    private boolean scamFlag;
}
