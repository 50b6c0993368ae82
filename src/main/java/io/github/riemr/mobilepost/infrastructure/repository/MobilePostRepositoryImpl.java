package io.github.riemr.mobilepost.infrastructure.repository;

import io.github.riemr.mobilepost.application.exception.DuplicateRecordException;
import io.github.riemr.mobilepost.application.exception.RecordNotFoundException;
import io.github.riemr.mobilepost.application.query.MobilePostFilter;
import io.github.riemr.mobilepost.application.query.PageResult;
import io.github.riemr.mobilepost.application.query.PageWindow;
import io.github.riemr.mobilepost.application.query.SortSpec;
import io.github.riemr.mobilepost.application.repository.MobilePostRepository;
import io.github.riemr.mobilepost.infrastructure.mapper.MobilePostMapper;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public class MobilePostRepositoryImpl implements MobilePostRepository {

    private final MobilePostMapper mapper;

    public MobilePostRepositoryImpl(MobilePostMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public PageResult<MobilePost> find(MobilePostFilter filter, SortSpec sort, PageWindow window) {
        long total = mapper.countByFilter(filter);
        if (total == 0 || window.offset() >= total) {
            return new PageResult<>(List.of(), total);
        }
        return new PageResult<>(mapper.selectByFilter(filter, sort, window.offset(), window.limit()), total);
    }

    @Override
    public MobilePost findById(Long id) {
        return mapper.selectByPrimaryKey(id);
    }

    @Override
    @Transactional
    public MobilePost create(MobilePost post) {
        try {
            mapper.insert(post);
        } catch (DuplicateKeyException e) {
            throw new DuplicateRecordException(duplicateMessage(post), e);
        }
        return mapper.selectByPrimaryKey(post.getId());
    }

    @Override
    @Transactional
    public MobilePost update(Long id, MobilePost changes) {
        int updated;
        try {
            updated = mapper.updateSelective(id, changes);
        } catch (DuplicateKeyException e) {
            throw new DuplicateRecordException(duplicateMessage(changes), e);
        }
        if (updated == 0) {
            throw new RecordNotFoundException(id);
        }
        return mapper.selectByPrimaryKey(id);
    }

    @Override
    @Transactional
    public void delete(Long id) {
        if (mapper.deleteByPrimaryKey(id) == 0) {
            throw new RecordNotFoundException(id);
        }
    }

    @Override
    public List<MobilePost> findAllIdentities() {
        return mapper.selectIdentities();
    }

    private static String duplicateMessage(MobilePost post) {
        return "A mobile post with mobileCode " + post.getMobileCode() + " and seq " + post.getSeq() + " already exists";
    }
}
