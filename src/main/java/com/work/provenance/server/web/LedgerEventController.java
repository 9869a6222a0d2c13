package com.work.provenance.server.web;

import com.work.provenance.core.event.EventJournal;
import com.work.provenance.core.model.LedgerEvent;
import com.work.provenance.server.web.dto.LedgerEventView;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * poll-only 的事件 feed：调用方记住最后一个 seq，下次以 afterSeq 续读。
 */
@RestController
@RequestMapping("/api/v1/events")
public class LedgerEventController {

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 200;

    private final EventJournal eventJournal;

    public LedgerEventController(EventJournal eventJournal) {
        this.eventJournal = eventJournal;
    }

    @GetMapping
    public ResponseEntity<List<LedgerEventView>> list(@RequestParam(value = "afterSeq", required = false) Long afterSeq,
                                                      @RequestParam(value = "limit", required = false) Integer limit) {
        int l = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(MAX_LIMIT, limit));
        List<LedgerEvent> rows = eventJournal.listAfter(afterSeq, l);
        List<LedgerEventView> out = new ArrayList<>(rows.size());
        for (LedgerEvent e : rows) {
            LedgerEventView v = new LedgerEventView();
            v.setSeq(e.getSeq());
            v.setType(e.getType().getEventName());
            v.setPayload(e.getPayload());
            v.setCreatedAt(e.getCreatedAt());
            out.add(v);
        }
        return ResponseEntity.ok(out);
    }
}
