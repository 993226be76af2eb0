package com.ksuid.application.port.in;

import com.ksuid.domain.model.Ksuid;

import java.util.List;

public interface GenerateKsuidsUseCase {
    List<Ksuid> generate(int count);
}
