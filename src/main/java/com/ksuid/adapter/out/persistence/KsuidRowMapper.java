package com.ksuid.adapter.out.persistence;

import com.ksuid.domain.model.Ksuid;
import com.ksuid.infrastructure.exception.InvalidKsuidException;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps a single KSUID column for use with {@link org.springframework.jdbc.core.JdbcTemplate}.
 * A column holding something that is not a KSUID raises {@link InvalidKsuidException}.
 */
public class KsuidRowMapper implements RowMapper<Ksuid> {

    private final String column;

    public KsuidRowMapper(String column) {
        this.column = column;
    }

    @Override
    public Ksuid mapRow(ResultSet rs, int rowNum) throws SQLException {
        return KsuidColumnConverter.scan(rs.getObject(column))
            .orElseThrow(InvalidKsuidException::new);
    }
}
