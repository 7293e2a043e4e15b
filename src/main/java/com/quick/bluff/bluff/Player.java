package com.quick.bluff.bluff;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class Player {
    private String id;
    private String name;
    private String connectionId;   // transport session the player joined from
    private boolean host;
    private List<Card> hand = new ArrayList<>();
}
