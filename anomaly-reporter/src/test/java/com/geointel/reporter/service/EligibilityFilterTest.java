package com.geointel.reporter.service;

import com.geointel.reporter.model.Issue;
import com.geointel.reporter.model.PolicyZone;
import com.geointel.reporter.store.IssueStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EligibilityFilterTest {

    @Mock
    private IssueStore store;

    @InjectMocks
    private EligibilityFilter filter;

    @Test
    void returnsStoreSelection() {
        Issue eligible = Issue.builder().externalKey("A").policyZone(PolicyZone.NOT_EXCLUDED).build();
        when(store.selectEligible()).thenReturn(List.of(eligible));

        assertThat(filter.selectEligible()).containsExactly(eligible);
    }

    @Test
    void storeErrorsPropagate() {
        when(store.selectEligible()).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> filter.selectEligible())
                .isInstanceOf(DataAccessResourceFailureException.class);
    }
}
