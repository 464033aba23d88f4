package com.example.goserver.logic;

import com.example.goserver.model.domain.GameSession;
import com.example.goserver.model.domain.GameStatus;
import com.example.goserver.model.domain.MoveRecord;
import com.example.goserver.model.domain.Player;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.StoneColor;
import com.example.goserver.model.domain.TimeControl;

import java.time.LocalDate;

/**
 * Writes a session's move log as an SGF (FF[4]) game record.
 */
public class SgfExporter {

    static final String APPLICATION = "GoServer:1.0";

    public String export(GameSession session, LocalDate date) {
        int size = session.getConfig().getBoardSize();
        StringBuilder sgf = new StringBuilder("(;FF[4]GM[1]CA[UTF-8]");
        sgf.append("SZ[").append(size).append(']');
        sgf.append("KM[").append(session.getKomi()).append(']');
        sgf.append("RU[").append(rulesetName(session)).append(']');
        sgf.append("DT[").append(date).append(']');
        sgf.append("AP[").append(APPLICATION).append(']');

        Player black = session.playerOf(StoneColor.BLACK);
        Player white = session.playerOf(StoneColor.WHITE);
        if (black != null) {
            sgf.append("PB[").append(escape(black.getUsername())).append(']');
        }
        if (white != null) {
            sgf.append("PW[").append(escape(white.getUsername())).append(']');
        }
        appendTimeControl(sgf, session.getConfig().getTimeControl());

        if (!session.getHandicapStones().isEmpty()) {
            sgf.append("HA[").append(session.getHandicapStones().size()).append(']');
            sgf.append("AB");
            for (Position p : session.getHandicapStones()) {
                sgf.append('[').append(point(p)).append(']');
            }
        }
        if (session.getStatus() == GameStatus.FINISHED && session.getResult() != null) {
            sgf.append("RE[").append(session.getResult().getCode()).append(']');
        }

        for (MoveRecord move : session.getHistory()) {
            sgf.append(';').append(move.getColor().code()).append('[');
            if (!move.isPass()) {
                sgf.append(point(move.getPosition()));
            }
            sgf.append(']');
        }
        return sgf.append(')').toString();
    }

    private void appendTimeControl(StringBuilder sgf, TimeControl tc) {
        if (tc == null || tc.unlimited()) {
            return;
        }
        if (tc.blitz()) {
            sgf.append("OT[").append(tc.getTimePerMoveSeconds()).append("s per move]");
            return;
        }
        sgf.append("TM[").append(tc.getMainTimeSeconds()).append(']');
        if (tc.getByoYomiPeriods() > 0) {
            sgf.append("OT[").append(tc.getByoYomiPeriods()).append('x').append(tc.getByoYomiSeconds())
                    .append(" byo-yomi]");
        } else if (tc.getFischerIncrementSeconds() > 0) {
            sgf.append("OT[+").append(tc.getFischerIncrementSeconds()).append(" fischer]");
        }
    }

    private String rulesetName(GameSession session) {
        String name = session.getConfig().getRuleset().name();
        if (name.length() <= 3) {
            return name; // AGA
        }
        return name.charAt(0) + name.substring(1).toLowerCase();
    }

    static String point(Position p) {
        return "" + (char) ('a' + p.x()) + (char) ('a' + p.y());
    }

    private String escape(String text) {
        return text == null ? "" : text.replace("\\", "\\\\").replace("]", "\\]");
    }
}
