package com.packages.search.model;

import com.packages.search.feed.FeedType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PackageSourceTest {

    @ParameterizedTest
    @CsvSource({
            "https://api.nuget.org/v3/index.json, HTTP_V3",
            "https://www.nuget.org/api/v2, HTTP_V2",
            "classpath:catalogs/local.json, LOCAL",
            "file:/srv/catalog.json, LOCAL",
            "/srv/catalog.json, LOCAL",
            "./catalog.json, LOCAL",
            "C:\\packages\\catalog.json, LOCAL",
            "ftp://mirror/catalog, UNKNOWN"
    })
    void classifiesByLocation(final String location, final FeedType expected) {
        assertThat(new PackageSource("s", location).feedType()).isEqualTo(expected);
    }

    @Test
    void hostIsOnlyKnownForHttpSources() {
        assertThat(new PackageSource("nuget", "https://api.nuget.org/v3/index.json").host())
                .contains("api.nuget.org");
        assertThat(new PackageSource("local", "classpath:catalog.json").host()).isEmpty();
    }

    @Test
    void rejectsBlankNameOrLocation() {
        assertThatThrownBy(() -> new PackageSource(" ", "classpath:x.json"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PackageSource("x", ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void identitiesCompareIdsCaseInsensitively() {
        PackageIdentity upper = new PackageIdentity("Serilog", "3.1.1");
        PackageIdentity lower = new PackageIdentity("serilog", "3.1.1");

        assertThat(upper).isEqualTo(lower).hasSameHashCodeAs(lower);
        assertThat(upper.key()).isEqualTo("serilog");
        assertThat(new PackageIdentity("NuGet.Protocol", "6.9.0-preview.1").isPrerelease()).isTrue();
        assertThat(upper.isPrerelease()).isFalse();
    }
}
