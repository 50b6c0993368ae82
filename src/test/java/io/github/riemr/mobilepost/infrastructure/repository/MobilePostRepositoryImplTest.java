package io.github.riemr.mobilepost.infrastructure.repository;

import io.github.riemr.mobilepost.application.exception.DuplicateRecordException;
import io.github.riemr.mobilepost.application.exception.RecordNotFoundException;
import io.github.riemr.mobilepost.application.query.LanguageResolver;
import io.github.riemr.mobilepost.application.query.MobilePostFilter;
import io.github.riemr.mobilepost.application.query.PageResult;
import io.github.riemr.mobilepost.application.query.PageWindow;
import io.github.riemr.mobilepost.application.query.SortResolver;
import io.github.riemr.mobilepost.application.query.SortSpec;
import io.github.riemr.mobilepost.domain.model.Language;
import io.github.riemr.mobilepost.domain.model.SortDirection;
import io.github.riemr.mobilepost.domain.model.SortField;
import io.github.riemr.mobilepost.infrastructure.mapper.MobilePostMapper;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.util.List;

import static io.github.riemr.mobilepost.support.MobilePosts.mobilePost;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MobilePostRepositoryImplTest {

    private MobilePostMapper mapper;
    private MobilePostRepositoryImpl repository;
    private final SortSpec byId = new SortResolver(new LanguageResolver()).resolve(SortField.ID, SortDirection.ASC, Language.EN);

    @BeforeEach
    void setup() {
        mapper = mock(MobilePostMapper.class);
        repository = new MobilePostRepositoryImpl(mapper);
    }

    @Test
    void find_selectsRequestedWindow() {
        MobilePostFilter filter = MobilePostFilter.none();
        when(mapper.countByFilter(filter)).thenReturn(72L);
        when(mapper.selectByFilter(filter, byId, 60L, 20)).thenReturn(List.of(mobilePost(61L, "MO1", 1, "a", "b")));

        PageResult<MobilePost> page = repository.find(filter, byId, new PageWindow(4, 20));

        assertThat(page.total()).isEqualTo(72);
        assertThat(page.records()).hasSize(1);
    }

    @Test
    void find_skipsSelect_whenWindowIsPastTheEnd() {
        MobilePostFilter filter = MobilePostFilter.none();
        when(mapper.countByFilter(filter)).thenReturn(5L);

        PageResult<MobilePost> page = repository.find(filter, byId, new PageWindow(2, 5));

        assertThat(page.records()).isEmpty();
        assertThat(page.total()).isEqualTo(5);
        verify(mapper, never()).selectByFilter(any(), any(), anyLong(), anyInt());
    }

    @Test
    void create_translatesUniquenessViolation() {
        MobilePost post = mobilePost(null, "MO1", 1, "a", "b");
        when(mapper.insert(post)).thenThrow(new DuplicateKeyException("uq_mobile_post_code_seq"));

        assertThatThrownBy(() -> repository.create(post))
                .isInstanceOf(DuplicateRecordException.class)
                .hasMessageContaining("MO1");
    }

    @Test
    void create_returnsStoredRow() {
        MobilePost post = mobilePost(null, "MO1", 1, "a", "b");
        MobilePost stored = mobilePost(10L, "MO1", 1, "a", "b");
        when(mapper.insert(post)).thenAnswer(invocation -> {
            post.setId(10L);
            return 1;
        });
        when(mapper.selectByPrimaryKey(10L)).thenReturn(stored);

        assertThat(repository.create(post)).isSameAs(stored);
    }

    @Test
    void update_andDelete_raiseNotFound_whenNoRowAffected() {
        when(mapper.updateSelective(eq(3L), any(MobilePost.class))).thenReturn(0);
        when(mapper.deleteByPrimaryKey(3L)).thenReturn(0);

        assertThatThrownBy(() -> repository.update(3L, new MobilePost())).isInstanceOf(RecordNotFoundException.class);
        assertThatThrownBy(() -> repository.delete(3L)).isInstanceOf(RecordNotFoundException.class);
    }
}
