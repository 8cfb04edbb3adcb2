package com.incoresoft.presenceTracker.domain.history.service;

import com.incoresoft.presenceTracker.config.PresenceProps;
import com.incoresoft.presenceTracker.domain.history.dto.HistoryPage;
import com.incoresoft.presenceTracker.domain.history.dto.HistoryStats;
import com.incoresoft.presenceTracker.domain.identity.service.IdentityStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
@RequiredArgsConstructor
public class HistoryService {

    private final HistoryLedger ledger;
    private final IdentityStore store;
    private final PresenceProps props;
    private final Clock clock;

    public HistoryPage query(Integer limit, String identityFilter) {
        int effective = limit == null ? props.getDefaultHistoryLimit() : limit;
        return ledger.query(effective, identityFilter);
    }

    public HistoryStats stats() {
        return ledger.stats(store.size(), clock.instant().minus(props.getRecentWindow()));
    }
}
