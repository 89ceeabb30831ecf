package com.whereq.evtfilter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds documents shaped like Log Parser's {@code -o:XML -structure:1} output.
 */
public final class EventXml {

    private final List<String> rows = new ArrayList<>();

    public static EventXml document() {
        return new EventXml();
    }

    public EventXml row(String timeGenerated, int eventId, String message) {
        rows.add("<ROW>\n"
                + "  <EventLog>Security</EventLog>\n"
                + "  <RecordNumber>" + (rows.size() + 1) + "</RecordNumber>\n"
                + "  <TimeGenerated>" + timeGenerated + "</TimeGenerated>\n"
                + "  <EventID>" + eventId + "</EventID>\n"
                + "  <Message>" + message + "</Message>\n"
                + "</ROW>\n");
        return this;
    }

    public String toXml(String declaredEncoding) {
        StringBuilder xml = new StringBuilder()
                .append("<?xml version=\"1.0\" encoding=\"").append(declaredEncoding).append("\" standalone=\"yes\" ?>\n")
                .append("<ROOT DATE_CREATED=\"2024-05-02 08:00:00\" CREATED_BY=\"Microsoft Log Parser V2.2\">\n");
        rows.forEach(xml::append);
        return xml.append("</ROOT>\n").toString();
    }

    public byte[] toUtf8() {
        return toXml("UTF-8").getBytes(StandardCharsets.UTF_8);
    }
}
