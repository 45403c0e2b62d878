package com.leadscoring.repository;

import com.leadscoring.Fixtures;
import com.leadscoring.model.ActivityKind;
import com.leadscoring.model.EngagementEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;

import static com.leadscoring.Fixtures.NOW;
import static com.leadscoring.Fixtures.PROSPECT;
import static com.leadscoring.Fixtures.TENANT;
import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class EngagementEventRepositoryTest {

    @Autowired
    private EngagementEventRepository repository;

    @Test
    @DisplayName("Same external activity id cannot be appended twice for a prospect")
    void testUniqueActivity() {
        EngagementEvent first = Fixtures.event(ActivityKind.OPENED, NOW);
        first.setExternalActivityId("msg-1");
        repository.saveAndFlush(first);

        EngagementEvent again = Fixtures.event(ActivityKind.CLICKED, NOW);
        again.setExternalActivityId("msg-1");

        assertThrows(DataIntegrityViolationException.class, () -> repository.saveAndFlush(again));
    }

    @Test
    @DisplayName("Dedup lookup is scoped to tenant and prospect")
    void testExistsScoped() {
        EngagementEvent event = Fixtures.event(ActivityKind.OPENED, NOW);
        event.setExternalActivityId("msg-7");
        repository.saveAndFlush(event);

        assertTrue(repository.existsByTenantIdAndProspectIdAndExternalActivityId(TENANT, PROSPECT, "msg-7"));
        assertFalse(repository.existsByTenantIdAndProspectIdAndExternalActivityId("other", PROSPECT, "msg-7"));
        assertFalse(repository.existsByTenantIdAndProspectIdAndExternalActivityId(TENANT, "p-43", "msg-7"));
    }

    @Test
    @DisplayName("Integration log spans every prospect reached through it")
    void testFindByIntegration() {
        EngagementEvent mine = Fixtures.event(ActivityKind.OPENED, NOW, "mailbox-9");
        EngagementEvent otherProspect = Fixtures.event(ActivityKind.REPLIED, NOW, "mailbox-9");
        otherProspect.setProspectId("p-43");
        EngagementEvent otherChannel = Fixtures.event(ActivityKind.CLICKED, NOW, "mailbox-2");
        repository.saveAllAndFlush(List.of(mine, otherProspect, otherChannel));

        List<EngagementEvent> found = repository.findByTenantIdAndIntegrationId(TENANT, "mailbox-9");

        assertEquals(2, found.size());
        assertTrue(found.stream().allMatch(e -> "mailbox-9".equals(e.getIntegrationId())));
    }
}
