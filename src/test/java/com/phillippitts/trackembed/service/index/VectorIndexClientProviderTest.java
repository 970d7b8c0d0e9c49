package com.phillippitts.trackembed.service.index;

import com.phillippitts.trackembed.exception.VectorIndexConnectionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ObjectProvider;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VectorIndexClientProviderTest {

    @Mock
    private ObjectProvider<VectorIndexClient> delegate;

    @Test
    void returnsCreatedClient() {
        VectorIndexClient client = mock(VectorIndexClient.class);
        when(delegate.getObject()).thenReturn(client);

        assertThat(new VectorIndexClientProvider(delegate).get()).isSameAs(client);
    }

    @Test
    void unwrapsConnectionFailureFromContainer() {
        VectorIndexConnectionException cause = new VectorIndexConnectionException("connect",
                "http://localhost:6333", 3, new IOException("Connection refused"));
        when(delegate.getObject()).thenThrow(new BeanCreationException("vectorIndexClient", "init failed", cause));

        assertThatThrownBy(() -> new VectorIndexClientProvider(delegate).get()).isSameAs(cause);
    }

    @Test
    void otherCreationFailuresPropagateUnchanged() {
        BeanCreationException failure = new BeanCreationException("vectorIndexClient", "bad config");
        when(delegate.getObject()).thenThrow(failure);

        assertThatThrownBy(() -> new VectorIndexClientProvider(delegate).get()).isSameAs(failure);
    }
}
