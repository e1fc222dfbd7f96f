package com.ciro.searchselect.standalone;

import com.ciro.searchselect.Item;

import java.util.List;

public class Main {

    public static void main(String[] args) {
        StandaloneConfig config = StandaloneConfig.load();

        SearchSelectServer server = new SearchSelectServer(config)
                .title("SearchSelect demo")
                .addWidget(WidgetDefinition.clearable("country", "Elige un país", Main::countries, null))
                .addWidget(WidgetDefinition.fixed("fruit", "Elige una fruta", Main::fruits, null));

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "searchselect-shutdown"));
        server.start();
    }

    static List<Item<String>> countries() {
        return List.of(
                Item.of("Argentina", "AR"),
                Item.of("Bolivia", "BO"),
                Item.of("Chile", "CL"),
                Item.of("Colombia", "CO"),
                Item.of("Ecuador", "EC"),
                Item.of("México", "MX"),
                Item.of("Paraguay", "PY"),
                Item.of("Perú", "PE"),
                Item.of("Uruguay", "UY"),
                Item.of("Venezuela", "VE"));
    }

    static List<Item<Integer>> fruits() {
        return List.of(
                Item.of("Apple", 1),
                Item.of("Banana", 2),
                Item.of("Avocado", 3),
                Item.of("Cherry", 4),
                Item.of("Mango", 5));
    }
}
