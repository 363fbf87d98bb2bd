package com.aurea.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aurea.service.core.api.FunnelNotFoundException;
import com.aurea.service.core.model.Funnel;
import com.aurea.service.core.repo.FunnelRepository;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class FunnelLookupTest {

    private final FunnelRepository repository = mock(FunnelRepository.class);
    private final FunnelLookup lookup = new FunnelLookup(repository);

    @Test
    void knownFunnelIsReadOnce() {
        UUID id = UUID.randomUUID();
        Funnel funnel = new Funnel(id, "org-1", null, "checkout");
        when(repository.findById(id)).thenReturn(Optional.of(funnel));

        assertThat(lookup.requireFunnel(id)).isEqualTo(funnel);
        assertThat(lookup.requireFunnel(id)).isEqualTo(funnel);
        verify(repository, times(1)).findById(id);
    }

    @Test
    void missingFunnelIsNotCached() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> lookup.requireFunnel(id)).isInstanceOf(FunnelNotFoundException.class);
        assertThatThrownBy(() -> lookup.requireFunnel(id))
                .isInstanceOf(FunnelNotFoundException.class)
                .hasMessage("Funnel not found: " + id);
        verify(repository, times(2)).findById(id);
    }
}
