package io.github.riemr.mobilepost.infrastructure.mapper;

import io.github.riemr.mobilepost.application.query.MobilePostFilter;
import io.github.riemr.mobilepost.application.query.SortSpec;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface MobilePostMapper {
    List<MobilePost> selectByFilter(@Param("filter") MobilePostFilter filter,
                                    @Param("sort") SortSpec sort,
                                    @Param("offset") long offset,
                                    @Param("limit") int limit);

    long countByFilter(@Param("filter") MobilePostFilter filter);

    MobilePost selectByPrimaryKey(@Param("id") Long id);

    int insert(MobilePost row);

    int updateSelective(@Param("id") Long id, @Param("changes") MobilePost changes);

    int deleteByPrimaryKey(@Param("id") Long id);

    List<MobilePost> selectIdentities();
}
