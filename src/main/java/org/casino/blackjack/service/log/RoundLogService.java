package org.casino.blackjack.service.log;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.extern.slf4j.Slf4j;
import org.casino.blackjack.config.SessionProperties;
import org.casino.blackjack.dto.RoundRecord;
import org.casino.blackjack.dto.RoundRecord.*;
import org.casino.blackjack.model.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Journal JSON de la session : un tableau, une entrée par round, relu et réécrit à chaque ajout.
 */
@Slf4j
@Service
public class RoundLogService {
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss");
    private static final String HIDDEN = "Hidden";

    private final ObjectMapper objectMapper;
    private final SessionProperties props;
    private Path logFile;

    public RoundLogService(ObjectMapper objectMapper, SessionProperties props) {
        this.objectMapper = objectMapper;
        this.props = props;
    }

    public RoundRecord buildRecord(Table t) {
        Hand dealerHand = t.getDealer().getHand(0);
        List<String> finalHand = dealerHand.describe();
        List<String> initial = new ArrayList<>();
        if (!finalHand.isEmpty()) {
            initial.add(finalHand.get(0));
            initial.add(HIDDEN);
        }
        DealerRecord dealer = new DealerRecord(initial, finalHand, dealerHand.value());

        List<ParticipantRecord> players = new ArrayList<>();
        for (Seat s : t.getSeats()) players.add(participantRecord(s.getParticipant()));
        return new RoundRecord(t.getRoundNumber(), dealer, players);
    }

    private ParticipantRecord participantRecord(Participant p) {
        List<ActionRecord> actions = new ArrayList<>();
        for (ActionLogEntry e : p.getActionLog()) {
            actions.add(new ActionRecord(e.action().label(), e.handIndex(), e.hand(), e.handValue(), e.dealerVisibleCard()));
        }
        List<HandRecord> hands = new ArrayList<>();
        for (Hand h : p.getHands()) {
            hands.add(new HandRecord(h.describe(), h.value(), h.getBet(), label(h.getResult())));
        }
        Hand first = p.getHand(0);
        return new ParticipantRecord(
                p.getName(),
                p.getCurrentBet(),
                actions,
                first.describe(),
                first.value(),
                label(p.getResult()),
                p.getBalance(),
                hands);
    }

    private static String label(RoundResult r) {
        return r == null ? "" : r.label();
    }

    /** Ajoute l'entrée au fichier de session. Un échec d'écriture est journalisé, la partie continue. */
    public synchronized void append(RoundRecord record) {
        try {
            Path file = logFile();
            JsonNode existing = objectMapper.readTree(file.toFile());
            ArrayNode logs = existing instanceof ArrayNode arr ? arr : objectMapper.createArrayNode();
            logs.add(objectMapper.valueToTree(record));
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), logs);
        } catch (IOException ex) {
            log.warn("Impossible d'écrire le round {} dans le journal: {}", record.gameNumber(), ex.getMessage(), ex);
        }
    }

    public synchronized Path logFile() throws IOException {
        if (logFile == null) {
            Path dir = Paths.get(props.getSession().getLogDir());
            Files.createDirectories(dir);
            Path file = dir.resolve("session_" + LocalDateTime.now().format(FILE_STAMP) + ".json");
            if (!Files.exists(file)) Files.writeString(file, "[]");
            logFile = file;
            log.info("Journal de session : {}", file.toAbsolutePath());
        }
        return logFile;
    }
}
