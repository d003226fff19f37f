package com.example.fok.domain;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Facility implements Serializable {

    private String id;
    private String name;
    private String district;
    private String address;
    private boolean active;
}
